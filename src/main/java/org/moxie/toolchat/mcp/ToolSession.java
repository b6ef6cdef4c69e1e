package org.moxie.toolchat.mcp;

import java.time.Clock;
import java.time.Instant;

/**
 * One live connection to one tool provider together with its health bookkeeping.
 * The bookkeeping fields are guarded by a per-session lock; calls through the
 * connection itself are not serialized here.
 */
public class ToolSession {

  private final Object lock = new Object();

  private final String                 providerName;
  private final McpServerConfig        config;
  private final ToolProviderConnection connection;
  private final Clock                  clock;

  private Instant lastUsedAt;
  private int     consecutiveFailures;
  private boolean closed;

  public ToolSession(String providerName, McpServerConfig config, ToolProviderConnection connection, Clock clock) {
    this.providerName = providerName;
    this.config       = config;
    this.connection   = connection;
    this.clock        = clock;
    this.lastUsedAt   = clock.instant();
  }

  public String getProviderName() {
    return providerName;
  }

  public McpServerConfig getConfig() {
    return config;
  }

  public ToolProviderConnection getConnection() {
    return connection;
  }

  public void recordSuccess() {
    synchronized (lock) {
      lastUsedAt          = clock.instant();
      consecutiveFailures = 0;
    }
  }

  public void recordFailure() {
    synchronized (lock) {
      consecutiveFailures++;
    }
  }

  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  public boolean isHealthy(int failureThreshold) {
    synchronized (lock) {
      return !closed && consecutiveFailures < failureThreshold;
    }
  }

  public Instant getLastUsedAt() {
    synchronized (lock) {
      return lastUsedAt;
    }
  }

  public int getConsecutiveFailures() {
    synchronized (lock) {
      return consecutiveFailures;
    }
  }

  /**
   * Flag the session closed. Returns false if it already was.
   */
  boolean markClosed() {
    synchronized (lock) {
      if (closed) {
        return false;
      }
      closed = true;
      return true;
    }
  }

  /**
   * Mark closed and release the connection. Idempotent.
   */
  public void close() {
    if (markClosed()) {
      connection.close();
    }
  }
}
