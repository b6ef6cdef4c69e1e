package org.moxie.toolchat.mcp;

import java.time.Duration;

/**
 * Opens connections to tool providers.
 */
public interface ToolProviderConnector {

  /**
   * Dial the provider and complete the protocol handshake.
   *
   * @param config         the provider configuration
   * @param connectTimeout deadline for dialing and handshake
   * @return an initialized connection
   * @throws ProviderConnectException if the provider is unreachable or the handshake fails
   */
  ToolProviderConnection connect(McpServerConfig config, Duration connectTimeout) throws ProviderConnectException;
}
