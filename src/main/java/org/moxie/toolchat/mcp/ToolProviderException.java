package org.moxie.toolchat.mcp;

/**
 * Exception thrown when a tool provider cannot be reached or fails a request.
 */
public class ToolProviderException extends Exception {
  public ToolProviderException(String message) {
    super(message);
  }

  public ToolProviderException(String message, Throwable cause) {
    super(message, cause);
  }

  public ToolProviderException(Throwable cause) {
    super(cause);
  }
}
