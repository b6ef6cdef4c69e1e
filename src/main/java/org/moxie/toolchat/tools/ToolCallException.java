package org.moxie.toolchat.tools;

/**
 * Base class for failures of a single named tool call.
 */
public abstract class ToolCallException extends Exception {

  private final String toolName;

  protected ToolCallException(String toolName, String message) {
    super(message);
    this.toolName = toolName;
  }

  protected ToolCallException(String toolName, String message, Throwable cause) {
    super(message, cause);
    this.toolName = toolName;
  }

  public String getToolName() {
    return toolName;
  }
}
