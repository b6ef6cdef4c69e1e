package org.moxie.toolchat.broadcast;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.moxie.toolchat.config.Config;
import org.moxie.toolchat.conversation.ConversationException;
import org.moxie.toolchat.conversation.ConversationLoop;
import org.moxie.toolchat.conversation.ConversationResult;
import org.moxie.toolchat.delivery.DeliveryException;
import org.moxie.toolchat.delivery.DeliveryTarget;
import org.moxie.toolchat.delivery.MessageDelivery;
import org.moxie.toolchat.llm.ChatMessage;
import org.moxie.toolchat.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Once a day at the configured local time, runs a conversation seeded with the push
 * prompt and delivers the answer to every configured target.
 */
@ApplicationScoped
public class BroadcastScheduler {

  private static final Logger log = LoggerFactory.getLogger(BroadcastScheduler.class);

  static final Duration GUARD_DELAY = Duration.ofSeconds(60);

  private final Config           config;
  private final ConversationLoop conversationLoop;
  private final MessageDelivery  delivery;
  private final Clock            clock;
  private final Sleeper          sleeper;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final Object        lock    = new Object();

  private Thread worker;

  @Inject
  public BroadcastScheduler(Config config, ConversationLoop conversationLoop, MessageDelivery delivery) {
    this(config, conversationLoop, delivery, Clock.systemDefaultZone(), Sleeper.SYSTEM);
  }

  public BroadcastScheduler(Config config, ConversationLoop conversationLoop, MessageDelivery delivery,
                            Clock clock, Sleeper sleeper)
  {
    this.config           = config;
    this.conversationLoop = conversationLoop;
    this.delivery         = delivery;
    this.clock            = clock;
    this.sleeper          = sleeper;
  }

  void onStartup(@Observes @Initialized(ApplicationScoped.class) Object event) {
    if (config.isPushEnabled()) {
      start();
    } else {
      log.info("Scheduled broadcast is disabled");
    }
  }

  /**
   * Start the driver thread. Does nothing if a driver loop is already running.
   */
  public void start() {
    synchronized (lock) {
      if (!running.compareAndSet(false, true)) {
        log.warn("Broadcast scheduler already running");
        return;
      }

      worker = new Thread(() -> {
        try {
          runLoop();
        } finally {
          running.set(false);
        }
      }, "broadcast-scheduler");
      worker.setDaemon(true);
      worker.start();
    }
  }

  @PreDestroy
  public void stop() {
    synchronized (lock) {
      if (worker != null) {
        worker.interrupt();
        worker = null;
      }
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  void runLoop() {
    FireTime fireTime;

    try {
      fireTime = FireTime.parse(config.getPushTime());
    } catch (IllegalArgumentException e) {
      log.error("Invalid push.time '{}', scheduled broadcast disabled: {}", config.getPushTime(), e.getMessage());
      return;
    }

    List<DeliveryTarget> targets = parseTargets(config.getPushTargets());
    log.info("Scheduled broadcast at {} to {} target(s)", fireTime, targets.size());

    try {
      while (!Thread.currentThread().isInterrupted()) {
        ZonedDateTime now  = ZonedDateTime.now(clock);
        ZonedDateTime next = fireTime.nextFireAfter(now);

        log.info("Next broadcast at {}", next);
        sleeper.sleep(Duration.between(now, next));

        fire(targets);

        sleeper.sleep(GUARD_DELAY);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Broadcast scheduler stopped");
    }
  }

  /**
   * Run one broadcast conversation and deliver its answer.
   *
   * @return the number of targets the answer reached
   */
  int fire(List<DeliveryTarget> targets) {
    List<ChatMessage> transcript = List.of(ChatMessage.system(config.getPushSystemPrompt()),
                                           ChatMessage.user(config.getPushPrompt()));

    ConversationResult result;
    try {
      result = conversationLoop.run(config.getDefaultAiConfig(), transcript, ConversationLoop.DEFAULT_MAX_ITERATIONS, null);
    } catch (ConversationException | RuntimeException e) {
      log.error("Broadcast conversation failed: {}", e.getMessage(), e);
      return 0;
    }

    if (result.finalText() == null || result.finalText().isBlank()) {
      log.warn("Broadcast conversation produced no content, nothing delivered");
      return 0;
    }

    int delivered = 0;

    for (DeliveryTarget target : targets) {
      try {
        delivery.deliver(target, result.finalText());
        delivered++;
      } catch (DeliveryException e) {
        log.error("Failed to deliver broadcast to {}: {}", target, e.getMessage());
      } catch (RuntimeException e) {
        log.error("Failed to deliver broadcast to {}: {}", target, e.getMessage(), e);
      }
    }

    log.info("Broadcast delivered to {}/{} target(s)", delivered, targets.size());
    return delivered;
  }

  static List<DeliveryTarget> parseTargets(List<String> values) {
    List<DeliveryTarget> targets = new ArrayList<>();

    for (String value : values) {
      try {
        targets.add(DeliveryTarget.parse(value));
      } catch (IllegalArgumentException e) {
        log.warn("Skipping broadcast target: {}", e.getMessage());
      }
    }

    return targets;
  }
}
