package org.moxie.toolchat.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.moxie.toolchat.tools.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes discovery and invocation through an initialized MCP client, each call
 * bounded by its own deadline.
 */
public class McpSdkConnection implements ToolProviderConnection {

  private static final Logger LOG = LoggerFactory.getLogger(McpSdkConnection.class);

  private static final ObjectMapper MAPPER = new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private final String          serverName;
  private final McpSyncClient   client;
  private final ExecutorService executor;

  public McpSdkConnection(String serverName, McpSyncClient client) {
    this.serverName = serverName;
    this.client     = client;
    this.executor   = Executors.newCachedThreadPool(r -> {
      Thread thread = new Thread(r, "mcp-" + serverName);
      thread.setDaemon(true);
      return thread;
    });
  }

  @Override
  public List<ToolDefinition> listTools(Duration timeout) throws ToolProviderException {
    McpSchema.ListToolsResult result = withDeadline("tools/list", client::listTools, timeout);

    if (result == null || result.tools() == null) {
      return List.of();
    }

    List<ToolDefinition> definitions = new ArrayList<>();

    for (McpSchema.Tool tool : result.tools()) {
      definitions.add(new ToolDefinition(tool.name(), tool.description(), convertInputSchema(tool)));
    }

    return definitions;
  }

  @Override
  public String callTool(String toolName, Map<String, Object> arguments, Duration timeout) throws ToolProviderException {
    McpSchema.CallToolRequest request = new McpSchema.CallToolRequest(toolName, arguments);
    return formatResult(withDeadline("tools/call " + toolName, () -> client.callTool(request), timeout));
  }

  @Override
  public void close() {
    try {
      client.closeGracefully();
      LOG.debug("Closed MCP client: {}", serverName);
    } catch (RuntimeException e) {
      LOG.warn("Error closing MCP client {}: {}", serverName, e.getMessage());
      client.close();
    } finally {
      executor.shutdownNow();
    }
  }

  private <T> T withDeadline(String operation, Callable<T> call, Duration timeout) throws ToolProviderException {
    Future<T> future = executor.submit(call);

    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new ToolProviderException(operation + " timed out after " + timeout.toMillis() + "ms on server " + serverName, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ToolProviderException(operation + " interrupted on server " + serverName, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new ToolProviderException(operation + " failed on server " + serverName + ": " + cause.getMessage(), cause);
    }
  }

  static JsonNode convertInputSchema(McpSchema.Tool tool) {
    if (tool.inputSchema() == null) {
      return emptyObjectSchema();
    }

    try {
      JsonNode schema = MAPPER.valueToTree(tool.inputSchema());

      if (!schema.isObject()) {
        return emptyObjectSchema();
      }

      ObjectNode objectSchema = (ObjectNode) schema;
      if (!objectSchema.has("type")) {
        objectSchema.put("type", "object");
      }
      if (!objectSchema.has("properties")) {
        objectSchema.putObject("properties");
      }
      return objectSchema;
    } catch (IllegalArgumentException e) {
      LOG.warn("Failed to convert input schema for tool {}: {}", tool.name(), e.getMessage());
      return emptyObjectSchema();
    }
  }

  private static ObjectNode emptyObjectSchema() {
    ObjectNode schema = MAPPER.createObjectNode();
    schema.put("type", "object");
    schema.putObject("properties");
    return schema;
  }

  static String formatResult(McpSchema.CallToolResult result) {
    if (result == null || result.content() == null || result.content().isEmpty()) {
      return "";
    }

    StringBuilder sb = new StringBuilder();
    for (McpSchema.Content content : result.content()) {
      if (content instanceof McpSchema.TextContent textContent) {
        sb.append(textContent.text());
      } else if (content instanceof McpSchema.ImageContent imageContent) {
        sb.append("[Image: ").append(imageContent.mimeType()).append("]");
      } else if (content instanceof McpSchema.EmbeddedResource embeddedResource) {
        sb.append("[Resource: ").append(embeddedResource.resource().uri()).append("]");
      } else {
        sb.append("[Unsupported content]");
      }
      sb.append("\n");
    }

    if (Boolean.TRUE.equals(result.isError())) {
      return "Tool error: " + sb.toString().trim();
    }

    return sb.toString().trim();
  }
}
