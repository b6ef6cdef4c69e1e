package org.moxie.toolchat.tools;

/**
 * The provider owning the requested tool has been shut down.
 */
public class SessionClosedException extends ToolCallException {

  private final String providerName;

  public SessionClosedException(String toolName, String providerName) {
    super(toolName, "session closed for tool: " + toolName + " (server: " + providerName + ")");
    this.providerName = providerName;
  }

  public String getProviderName() {
    return providerName;
  }
}
