package org.moxie.toolchat.mcp;

import org.moxie.toolchat.tools.ToolDefinition;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A live, initialized connection to one tool provider, independent of the
 * transport it runs over.
 */
public interface ToolProviderConnection extends AutoCloseable {

  /**
   * List the tools the provider exposes.
   *
   * @param timeout deadline for the whole discovery
   * @return the discovered tools, never null
   * @throws ToolProviderException if discovery fails or times out
   */
  List<ToolDefinition> listTools(Duration timeout) throws ToolProviderException;

  /**
   * Invoke a tool by name.
   *
   * @param toolName  the provider-side tool name
   * @param arguments parsed tool arguments
   * @param timeout   deadline for this single invocation
   * @return the textual tool result
   * @throws ToolProviderException if the call fails or times out
   */
  String callTool(String toolName, Map<String, Object> arguments, Duration timeout) throws ToolProviderException;

  /**
   * Release the connection, terminating the provider subprocess where there is one.
   */
  @Override
  void close();
}
