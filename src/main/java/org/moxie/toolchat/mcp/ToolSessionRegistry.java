package org.moxie.toolchat.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.moxie.toolchat.config.Config;
import org.moxie.toolchat.tools.SessionClosedException;
import org.moxie.toolchat.tools.ToolCallException;
import org.moxie.toolchat.tools.ToolDefinition;
import org.moxie.toolchat.tools.ToolInvocationPipeline;
import org.moxie.toolchat.tools.ToolNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds every live tool provider session, the merged tool catalog and the index from
 * tool name to owning session.
 *
 * Reads take the shared lock and never block each other. The catalog and index are
 * only mutated by connectAll and closeAll under the exclusive lock, and dialing a
 * provider happens outside of it.
 */
@ApplicationScoped
public class ToolSessionRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(ToolSessionRegistry.class);

  public static final int      UNHEALTHY_FAILURE_THRESHOLD = 5;
  public static final Duration CONNECT_TIMEOUT             = Duration.ofSeconds(15);
  public static final Duration DISCOVERY_TIMEOUT           = Duration.ofSeconds(10);

  private final Config                 config;
  private final ObjectMapper           mapper;
  private final ToolProviderConnector  connector;
  private final ToolInvocationPipeline pipeline;
  private final Clock                  clock;

  private final ReadWriteLock               lock         = new ReentrantReadWriteLock();
  private final Map<String, ToolSession>    sessions     = new LinkedHashMap<>();
  private final Map<String, ToolDefinition> catalog      = new LinkedHashMap<>();
  private final Map<String, ToolSession>    toolIndex    = new HashMap<>();
  private final Map<String, String>         retiredTools = new HashMap<>();

  @Inject
  public ToolSessionRegistry(Config config, ObjectMapper mapper, ToolInvocationPipeline pipeline) {
    this(config, mapper,
         new McpSdkConnector(new ProviderTransportFactory(config.getProxyUrl()), pipeline.getPolicy().attemptTimeout()),
         pipeline, Clock.systemDefaultZone());
  }

  public ToolSessionRegistry(Config config, ObjectMapper mapper, ToolProviderConnector connector,
                             ToolInvocationPipeline pipeline, Clock clock)
  {
    this.config    = config;
    this.mapper    = mapper;
    this.connector = connector;
    this.pipeline  = pipeline;
    this.clock     = clock;
  }

  void onStartup(@Observes @Initialized(ApplicationScoped.class) Object event) {
    init();
  }

  void init() {
    if (!config.isMcpEnabled()) {
      LOG.info("MCP support is disabled");
      return;
    }

    String serversJson = config.getMcpServersConfig();
    if (serversJson == null || serversJson.isBlank()) {
      LOG.warn("MCP is enabled but no servers configured (mcp.servers.config is empty)");
      return;
    }

    try {
      connectAll(McpServerConfigs.parse(mapper, serversJson));
    } catch (Exception e) {
      LOG.error("Failed to initialize MCP clients: {}", e.getMessage(), e);
    }
  }

  @PreDestroy
  void shutdown() {
    closeAll();
  }

  /**
   * Connect every configured provider independently. A provider that fails to connect
   * or to list its tools is logged and contributes no tools.
   */
  public void connectAll(Map<String, McpServerConfig> serverConfigs) {
    LOG.info("Initializing {} MCP server connection(s)", serverConfigs.size());

    for (Map.Entry<String, McpServerConfig> entry : serverConfigs.entrySet()) {
      connectServer(entry.getKey(), entry.getValue());
    }

    lock.readLock().lock();
    try {
      LOG.info("MCP initialization complete. Registered {} tools from {} servers", catalog.size(), sessions.size());
    } finally {
      lock.readLock().unlock();
    }
  }

  private void connectServer(String name, McpServerConfig serverConfig) {
    LOG.info("Connecting to MCP server: {} (transport: {})", name, serverConfig.kind());

    ToolProviderConnection connection;
    List<ToolDefinition>   tools;

    try {
      connection = connector.connect(serverConfig, CONNECT_TIMEOUT);
    } catch (ProviderConnectException | RuntimeException e) {
      LOG.error("Failed to connect to MCP server {}: {}", name, e.getMessage(), e);
      return;
    }

    try {
      tools = connection.listTools(DISCOVERY_TIMEOUT);
    } catch (ToolProviderException | RuntimeException e) {
      LOG.error("Failed to discover tools from MCP server {}: {}", name, e.getMessage(), e);
      closeQuietly(name, connection);
      return;
    }

    ToolSession session  = new ToolSession(name, serverConfig, connection, clock);
    ToolSession replaced;

    lock.writeLock().lock();
    try {
      replaced = sessions.get(name);
      if (replaced != null) {
        retire(replaced);
      }

      sessions.put(name, session);

      for (ToolDefinition tool : tools) {
        ToolSession previousOwner = toolIndex.put(tool.name(), session);
        if (previousOwner != null && previousOwner != session) {
          LOG.warn("Tool {} from server {} replaces the one from server {}", tool.name(), name, previousOwner.getProviderName());
        }

        catalog.remove(tool.name());
        catalog.put(tool.name(), tool);
        retiredTools.remove(tool.name());
        LOG.debug("Registered MCP tool: {} (server: {})", tool.name(), name);
      }
    } finally {
      lock.writeLock().unlock();
    }

    if (replaced != null) {
      closeQuietly(name, replaced.getConnection());
    }

    if (tools.isEmpty()) {
      LOG.info("No tools discovered from server: {}", name);
    } else {
      LOG.info("Discovered {} tools from server: {}", tools.size(), name);
    }
  }

  /**
   * The merged catalog, most recently registered last.
   */
  public List<ToolDefinition> listTools() {
    lock.readLock().lock();
    try {
      return List.copyOf(catalog.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Invoke a tool through its owning session.
   *
   * @throws ToolNotFoundException   if no provider ever registered the name
   * @throws SessionClosedException  if the owning provider has been shut down
   * @throws ToolCallException       if every attempt failed
   */
  public String callTool(String toolName, Map<String, Object> arguments) throws ToolCallException {
    ToolSession session;

    lock.readLock().lock();
    try {
      session = toolIndex.get(toolName);

      if (session == null) {
        String retiredOwner = retiredTools.get(toolName);
        if (retiredOwner != null) {
          throw new SessionClosedException(toolName, retiredOwner);
        }
        throw new ToolNotFoundException(toolName);
      }
    } finally {
      lock.readLock().unlock();
    }

    return pipeline.invoke(session, toolName, arguments == null ? Map.of() : arguments);
  }

  /**
   * Provider name to health: open and below the consecutive failure threshold.
   */
  public Map<String, Boolean> healthCheck() {
    lock.readLock().lock();
    try {
      Map<String, Boolean> health = new LinkedHashMap<>();
      for (Map.Entry<String, ToolSession> entry : sessions.entrySet()) {
        health.put(entry.getKey(), entry.getValue().isHealthy(UNHEALTHY_FAILURE_THRESHOLD));
      }
      return health;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Close every session and clear the catalog. Safe to call more than once.
   */
  public void closeAll() {
    List<ToolSession> closing = new ArrayList<>();

    lock.writeLock().lock();
    try {
      if (sessions.isEmpty()) {
        return;
      }

      LOG.info("Shutting down {} MCP client(s)", sessions.size());

      for (ToolSession session : sessions.values()) {
        if (retire(session)) {
          closing.add(session);
        }
      }

      sessions.clear();
      catalog.clear();
      toolIndex.clear();
    } finally {
      lock.writeLock().unlock();
    }

    for (ToolSession session : closing) {
      if (closeQuietly(session.getProviderName(), session.getConnection())) {
        LOG.info("Closed MCP session: {}", session.getProviderName());
      }
    }
  }

  private static boolean closeQuietly(String serverName, ToolProviderConnection connection) {
    try {
      connection.close();
      return true;
    } catch (RuntimeException e) {
      LOG.warn("Error closing MCP client {}: {}", serverName, e.getMessage());
      return false;
    }
  }

  /**
   * Mark the session closed and move its tools from the index to the retired set.
   * Caller holds the write lock.
   */
  private boolean retire(ToolSession session) {
    boolean closedNow = session.markClosed();

    Iterator<Map.Entry<String, ToolSession>> entries = toolIndex.entrySet().iterator();
    while (entries.hasNext()) {
      Map.Entry<String, ToolSession> entry = entries.next();
      if (entry.getValue() == session) {
        entries.remove();
        catalog.remove(entry.getKey());
        retiredTools.put(entry.getKey(), session.getProviderName());
      }
    }

    return closedNow;
  }

  ToolSession getSession(String providerName) {
    lock.readLock().lock();
    try {
      return sessions.get(providerName);
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isConnected(String serverName) {
    lock.readLock().lock();
    try {
      return sessions.containsKey(serverName);
    } finally {
      lock.readLock().unlock();
    }
  }

  public int getConnectedServerCount() {
    lock.readLock().lock();
    try {
      return sessions.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public int getRegisteredToolCount() {
    lock.readLock().lock();
    try {
      return catalog.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
