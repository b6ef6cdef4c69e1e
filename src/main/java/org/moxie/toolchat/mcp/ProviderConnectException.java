package org.moxie.toolchat.mcp;

/**
 * Exception thrown when a tool provider is unreachable, fails the handshake or fails
 * tool discovery. The provider is excluded until the next connect.
 */
public class ProviderConnectException extends ToolProviderException {
  public ProviderConnectException(String message) {
    super(message);
  }

  public ProviderConnectException(String message, Throwable cause) {
    super(message, cause);
  }
}
