package org.moxie.toolchat.tools;

/**
 * No connected provider ever registered the requested tool.
 */
public class ToolNotFoundException extends ToolCallException {
  public ToolNotFoundException(String toolName) {
    super(toolName, "tool not found: " + toolName);
  }
}
