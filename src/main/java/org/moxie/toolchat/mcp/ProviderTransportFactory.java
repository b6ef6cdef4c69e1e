package org.moxie.toolchat.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.spec.McpClientTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the MCP client transport for one configured provider.
 */
public class ProviderTransportFactory {

  private static final Logger LOG = LoggerFactory.getLogger(ProviderTransportFactory.class);

  private static final McpJsonMapper JSON_MAPPER = new JacksonMcpJsonMapper(new ObjectMapper());

  static final List<String> PROXY_VARIABLES = List.of("HTTP_PROXY", "HTTPS_PROXY", "http_proxy", "https_proxy");

  private final String              proxyUrl;
  private final Map<String, String> parentEnvironment;
  private final EnvironmentExpander expander;

  public ProviderTransportFactory(String proxyUrl) {
    this(proxyUrl, System.getenv(), new EnvironmentExpander());
  }

  public ProviderTransportFactory(String proxyUrl, Map<String, String> parentEnvironment, EnvironmentExpander expander) {
    this.proxyUrl          = proxyUrl;
    this.parentEnvironment = parentEnvironment;
    this.expander          = expander;
  }

  public McpClientTransport createTransport(McpServerConfig serverConfig) {
    return switch (serverConfig.kind()) {
      case STDIO           -> createStdioTransport(serverConfig);
      case SSE             -> createSseTransport(serverConfig);
      case STREAMABLE_HTTP -> createStreamableTransport(serverConfig);
    };
  }

  private McpClientTransport createStdioTransport(McpServerConfig serverConfig) {
    if (serverConfig.command() == null || serverConfig.command().isBlank()) {
      throw new IllegalArgumentException("Stdio transport requires 'command' to be specified");
    }

    ServerParameters.Builder builder = ServerParameters.builder(serverConfig.command());

    if (!serverConfig.args().isEmpty()) {
      builder.args(serverConfig.args().toArray(new String[0]));
    }

    builder.env(buildProcessEnvironment(serverConfig));

    LOG.info("MCP server {} will use stdio transport (command: {}, proxy: {})",
        serverConfig.name(), serverConfig.command(), usesProxy(serverConfig));

    return new StdioClientTransport(builder.build(), JSON_MAPPER);
  }

  private McpClientTransport createSseTransport(McpServerConfig serverConfig) {
    Endpoint endpoint = splitUrl(serverConfig);
    HttpClientSseClientTransport.Builder builder = HttpClientSseClientTransport.builder(endpoint.baseUri())
        .sseEndpoint(endpoint.path())
        .jsonMapper(JSON_MAPPER)
        .customizeRequest(request -> resolveHeaders(serverConfig).forEach(request::setHeader));

    proxySelector(serverConfig).ifPresent(selector -> builder.customizeClient(client -> client.proxy(selector)));

    LOG.info("MCP server {} will use SSE transport (url: {}, proxy: {})",
        serverConfig.name(), serverConfig.url(), usesProxy(serverConfig));

    return builder.build();
  }

  private McpClientTransport createStreamableTransport(McpServerConfig serverConfig) {
    Endpoint endpoint = splitUrl(serverConfig);
    HttpClientStreamableHttpTransport.Builder builder = HttpClientStreamableHttpTransport.builder(endpoint.baseUri())
        .endpoint(endpoint.path())
        .jsonMapper(JSON_MAPPER)
        .customizeRequest(request -> resolveHeaders(serverConfig).forEach(request::setHeader));

    proxySelector(serverConfig).ifPresent(selector -> builder.customizeClient(client -> client.proxy(selector)));

    LOG.info("MCP server {} will use streamable HTTP transport (url: {}, proxy: {})",
        serverConfig.name(), serverConfig.url(), usesProxy(serverConfig));

    return builder.build();
  }

  /**
   * Parent environment, then the proxy variables if the provider opts in, then the
   * provider's own entries, which win over both.
   */
  Map<String, String> buildProcessEnvironment(McpServerConfig serverConfig) {
    Map<String, String> environment = new LinkedHashMap<>(parentEnvironment);

    if (usesProxy(serverConfig)) {
      for (String variable : PROXY_VARIABLES) {
        environment.put(variable, proxyUrl);
      }
    }

    environment.putAll(serverConfig.env());
    return environment;
  }

  /**
   * Header values are expanded on every request so rotated credentials are picked up.
   */
  Map<String, String> resolveHeaders(McpServerConfig serverConfig) {
    Map<String, String> headers = new LinkedHashMap<>();
    serverConfig.headers().forEach((name, value) -> headers.put(name, expander.expand(value)));
    return headers;
  }

  Optional<ProxySelector> proxySelector(McpServerConfig serverConfig) {
    if (!usesProxy(serverConfig)) {
      return Optional.empty();
    }

    URI proxy = URI.create(proxyUrl);

    if (proxy.getHost() == null) {
      throw new IllegalArgumentException("Invalid proxy URL: " + proxyUrl);
    }

    int port = proxy.getPort() != -1 ? proxy.getPort() : ("https".equalsIgnoreCase(proxy.getScheme()) ? 443 : 80);
    return Optional.of(ProxySelector.of(new InetSocketAddress(proxy.getHost(), port)));
  }

  private boolean usesProxy(McpServerConfig serverConfig) {
    return serverConfig.useProxy() && proxyUrl != null && !proxyUrl.isBlank();
  }

  static Endpoint splitUrl(McpServerConfig serverConfig) {
    if (serverConfig.url() == null || serverConfig.url().isBlank()) {
      throw new IllegalArgumentException(serverConfig.kind() + " transport requires 'url' to be specified");
    }

    URI uri = URI.create(serverConfig.url().trim());

    if (uri.getScheme() == null || uri.getRawAuthority() == null) {
      throw new IllegalArgumentException("MCP server url must be absolute: " + serverConfig.url());
    }

    String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();

    if (uri.getRawQuery() != null) {
      path = path + "?" + uri.getRawQuery();
    }

    return new Endpoint(uri.getScheme() + "://" + uri.getRawAuthority(), path);
  }

  record Endpoint(String baseUri, String path) {}
}
