package org.moxie.toolchat.tools;

import java.time.Duration;

/**
 * Bounded retry for a single tool call.
 *
 * @param maxAttempts    total attempts, including the first
 * @param backoffStep    the wait before attempt {@code i} (0-based) is {@code i * backoffStep}
 * @param attemptTimeout deadline applied to each attempt on its own
 */
public record RetryPolicy(int maxAttempts, Duration backoffStep, Duration attemptTimeout) {

  public static final RetryPolicy DEFAULT = new RetryPolicy(2, Duration.ofMillis(500), Duration.ofSeconds(60));

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (backoffStep == null || backoffStep.isNegative()) {
      throw new IllegalArgumentException("backoffStep must not be negative");
    }
    if (attemptTimeout == null || attemptTimeout.isNegative() || attemptTimeout.isZero()) {
      throw new IllegalArgumentException("attemptTimeout must be positive");
    }
  }

  public Duration backoffBefore(int attemptIndex) {
    return backoffStep.multipliedBy(attemptIndex);
  }
}
