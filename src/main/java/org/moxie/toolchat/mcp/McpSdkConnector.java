package org.moxie.toolchat.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpClientTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Connects to tool providers with the MCP Java SDK's synchronous client.
 */
public class McpSdkConnector implements ToolProviderConnector {

  private static final Logger LOG = LoggerFactory.getLogger(McpSdkConnector.class);

  private final ProviderTransportFactory transportFactory;
  private final Duration                 requestTimeout;

  public McpSdkConnector(ProviderTransportFactory transportFactory, Duration requestTimeout) {
    this.transportFactory = transportFactory;
    this.requestTimeout   = requestTimeout;
  }

  @Override
  public ToolProviderConnection connect(McpServerConfig serverConfig, Duration connectTimeout) throws ProviderConnectException {
    McpClientTransport transport;

    try {
      transport = transportFactory.createTransport(serverConfig);
    } catch (IllegalArgumentException e) {
      throw new ProviderConnectException("Invalid configuration for MCP server " + serverConfig.name() + ": " + e.getMessage(), e);
    }

    McpSyncClient client = McpClient.sync(transport)
        .requestTimeout(requestTimeout)
        .initializationTimeout(connectTimeout)
        .build();

    try {
      client.initialize();
    } catch (RuntimeException e) {
      closeQuietly(serverConfig.name(), client);
      throw new ProviderConnectException("Connect failed for MCP server " + serverConfig.name() + ": " + e.getMessage(), e);
    }

    LOG.info("Connected to MCP server: {}", serverConfig.name());
    return new McpSdkConnection(serverConfig.name(), client);
  }

  private static void closeQuietly(String serverName, McpSyncClient client) {
    try {
      client.close();
    } catch (RuntimeException e) {
      LOG.warn("Error closing MCP client {} after failed connect: {}", serverName, e.getMessage());
    }
  }
}
