package org.moxie.toolchat.tools;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.moxie.toolchat.mcp.ToolProviderException;
import org.moxie.toolchat.mcp.ToolSession;
import org.moxie.toolchat.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Executes one named tool call against its owning session with bounded retry and
 * keeps the session's health counters current.
 */
@ApplicationScoped
public class ToolInvocationPipeline {

  private static final Logger log = LoggerFactory.getLogger(ToolInvocationPipeline.class);

  private final RetryPolicy policy;
  private final Sleeper     sleeper;

  @Inject
  public ToolInvocationPipeline() {
    this(RetryPolicy.DEFAULT, Sleeper.SYSTEM);
  }

  public ToolInvocationPipeline(RetryPolicy policy, Sleeper sleeper) {
    this.policy  = policy;
    this.sleeper = sleeper;
  }

  /**
   * Call the tool, retrying failed attempts. The session's failure counter moves by
   * at most one per call, however many attempts were made, and not at all when the
   * calling thread is interrupted.
   *
   * @throws SessionClosedException   if the session is closed before or during the call
   * @throws ToolInvocationException  if every attempt failed
   */
  public String invoke(ToolSession session, String toolName, Map<String, Object> arguments) throws ToolCallException {
    ToolProviderException lastError = null;
    int                   attempts  = 0;

    for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
      if (attempt > 0) {
        Duration delay = policy.backoffBefore(attempt);
        log.debug("Retrying tool call {} (attempt {}) after {}ms", toolName, attempt + 1, delay.toMillis());

        try {
          sleeper.sleep(delay);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new ToolInvocationException(toolName, attempts, e);
        }
      }

      if (session.isClosed()) {
        throw new SessionClosedException(toolName, session.getProviderName());
      }

      attempts++;

      try {
        String result = session.getConnection().callTool(toolName, arguments, policy.attemptTimeout());
        session.recordSuccess();
        return result;
      } catch (ToolProviderException e) {
        lastError = e;
        log.warn("Tool call {} failed (server: {}, attempt {}/{}): {}",
            toolName, session.getProviderName(), attempt + 1, policy.maxAttempts(), e.getMessage());
      }

      if (Thread.currentThread().isInterrupted()) {
        break;
      }
    }

    if (session.isClosed()) {
      throw new SessionClosedException(toolName, session.getProviderName());
    }

    // a cancelled caller is not a provider fault
    if (!Thread.currentThread().isInterrupted()) {
      session.recordFailure();
    }
    throw new ToolInvocationException(toolName, attempts, lastError);
  }

  public RetryPolicy getPolicy() {
    return policy;
  }
}
