package org.moxie.toolchat.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the mcp.servers.config property into provider configurations keyed by name.
 */
public final class McpServerConfigs {

  private McpServerConfigs() {}

  /**
   * Accepts a bare array of servers, an object with a "servers" array, or an object
   * with an "mcpServers" map keyed by server name.
   */
  public static Map<String, McpServerConfig> parse(ObjectMapper mapper, String json) throws JsonProcessingException {
    JsonNode root = mapper.readTree(json);

    if (root == null || root.isMissingNode() || root.isNull()) {
      return Map.of();
    }

    Map<String, McpServerConfig> configs = new LinkedHashMap<>();

    if (root.isArray()) {
      addAll(mapper, root, configs);
    } else if (root.has("servers") && root.get("servers").isArray()) {
      addAll(mapper, root.get("servers"), configs);
    } else if (root.has("mcpServers") && root.get("mcpServers").isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = root.get("mcpServers").fields();

      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();

        if (!field.getValue().isObject()) {
          throw new IllegalArgumentException("MCP server entry must be an object: " + field.getKey());
        }

        ObjectNode entry = ((ObjectNode) field.getValue()).deepCopy();
        entry.put("name", field.getKey());
        put(configs, mapper.treeToValue(entry, McpServerConfig.class));
      }
    } else {
      throw new IllegalArgumentException("Invalid MCP config format: expected array, {\"servers\": [...]} or {\"mcpServers\": {...}}");
    }

    return configs;
  }

  private static void addAll(ObjectMapper mapper, JsonNode array, Map<String, McpServerConfig> configs) throws JsonProcessingException {
    for (JsonNode node : array) {
      put(configs, mapper.treeToValue(node, McpServerConfig.class));
    }
  }

  private static void put(Map<String, McpServerConfig> configs, McpServerConfig config) {
    if (configs.put(config.name(), config) != null) {
      throw new IllegalArgumentException("Duplicate MCP server name: " + config.name());
    }
  }
}
