package org.moxie.toolchat.tools;

/**
 * Every attempt at a tool call failed; the cause is the last underlying error.
 */
public class ToolInvocationException extends ToolCallException {

  private final int attempts;

  public ToolInvocationException(String toolName, int attempts, Throwable cause) {
    super(toolName, "tool call failed after " + attempts + " attempt(s): " + toolName
        + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
