package org.moxie.toolchat.mcp;

import java.util.Locale;

/**
 * The transports a tool provider can be reached over.
 */
public enum TransportKind {
  STREAMABLE_HTTP,
  SSE,
  STDIO;

  /**
   * Resolve the transport for a provider entry. A configured command always means a
   * locally spawned subprocess; otherwise "sse" selects the push stream and anything
   * else falls back to streamed HTTP.
   */
  public static TransportKind resolve(String transport, String command) {
    String normalized = transport == null ? "" : transport.trim().toLowerCase(Locale.ROOT);

    if ("stdio".equals(normalized) || (command != null && !command.isBlank())) {
      return STDIO;
    }

    if ("sse".equals(normalized)) {
      return SSE;
    }

    return STREAMABLE_HTTP;
  }
}
