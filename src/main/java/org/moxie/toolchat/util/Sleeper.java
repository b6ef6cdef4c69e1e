package org.moxie.toolchat.util;

import java.time.Duration;

/**
 * Suspends the calling thread. Injected wherever a wait must be observable in tests.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> {
    if (!duration.isNegative() && !duration.isZero()) {
      Thread.sleep(duration.toMillis());
    }
  };

  void sleep(Duration duration) throws InterruptedException;
}
