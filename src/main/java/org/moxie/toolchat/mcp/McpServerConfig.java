package org.moxie.toolchat.mcp;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Map;

/**
 * Configuration for a single MCP server connection.
 *
 * Example JSON:
 * {
 *   "name": "search",
 *   "type": "streamable_http",
 *   "url": "https://example.com/mcp",
 *   "headers": {"Authorization": "Bearer ${SEARCH_API_KEY}"},
 *   "use_proxy": true
 * }
 *
 * or, for a subprocess:
 * {
 *   "name": "filesystem",
 *   "command": "npx",
 *   "args": ["-y", "@modelcontextprotocol/server-filesystem", "/allowed/path"],
 *   "env": {"SOME_VAR": "value"}
 * }
 */
public record McpServerConfig(
    String name,
    @JsonAlias("type") String transport,  // "streamable_http", "sse" or "stdio"
    String url,                           // For HTTP transports: the server URL
    Map<String, String> headers,          // For HTTP transports: extra request headers
    String command,                       // For stdio: the command to run
    List<String> args,                    // For stdio: command arguments
    Map<String, String> env,              // For stdio: environment overrides
    @JsonAlias("use_proxy") boolean useProxy
) {

  public McpServerConfig {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("MCP server name is required");
    }
    if (headers == null) {
      headers = Map.of();
    }
    if (args == null) {
      args = List.of();
    }
    if (env == null) {
      env = Map.of();
    }
    headers = Map.copyOf(headers);
    args    = List.copyOf(args);
    env     = Map.copyOf(env);
  }

  @JsonIgnore
  public TransportKind kind() {
    return TransportKind.resolve(transport, command);
  }
}
