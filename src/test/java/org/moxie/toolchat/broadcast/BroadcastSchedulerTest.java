package org.moxie.toolchat.broadcast;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.moxie.toolchat.config.Config;
import org.moxie.toolchat.conversation.ConversationLoop;
import org.moxie.toolchat.conversation.ConversationResult;
import org.moxie.toolchat.conversation.GenerationException;
import org.moxie.toolchat.delivery.DeliveryException;
import org.moxie.toolchat.delivery.DeliveryTarget;
import org.moxie.toolchat.delivery.MessageDelivery;
import org.moxie.toolchat.llm.AiConfig;
import org.moxie.toolchat.llm.ChatMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class BroadcastSchedulerTest {

  private static final AiConfig AI    = new AiConfig("openai", "https://api.openai.com/v1", "sk", "gpt-4o-mini", "");
  private static final Clock    CLOCK = Clock.fixed(Instant.parse("2025-03-10T07:30:00Z"), ZoneOffset.UTC);

  private Config           config;
  private ConversationLoop loop;
  private MessageDelivery  delivery;
  private List<Duration>   sleeps;

  @BeforeEach
  void setUp() {
    config   = mock(Config.class);
    loop     = mock(ConversationLoop.class);
    delivery = mock(MessageDelivery.class);
    sleeps   = new ArrayList<>();

    when(config.getDefaultAiConfig()).thenReturn(AI);
    when(config.getPushTime()).thenReturn("08:00");
    when(config.getPushTargets()).thenReturn(List.of("telegram:12345", "QQ:Group:456"));
    when(config.getPushPrompt()).thenReturn("Summarize today's news.");
    when(config.getPushSystemPrompt()).thenReturn("You are a news reporter.");
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  private BroadcastScheduler scheduler(int sleepsBeforeStop) {
    return new BroadcastScheduler(config, loop, delivery, CLOCK, duration -> {
      sleeps.add(duration);
      if (sleeps.size() >= sleepsBeforeStop) {
        throw new InterruptedException("stop");
      }
    });
  }

  @Test
  @SuppressWarnings("unchecked")
  void testFireRunsPushConversationAndDeliversToAllTargets() throws Exception {
    when(loop.run(eq(AI), anyList(), eq(ConversationLoop.DEFAULT_MAX_ITERATIONS), isNull()))
        .thenReturn(new ConversationResult("Today's news", List.of(), 2));

    int delivered = scheduler(10).fire(BroadcastScheduler.parseTargets(config.getPushTargets()));

    assertEquals(2, delivered);
    verify(delivery).deliver(DeliveryTarget.parse("telegram:12345"), "Today's news");
    verify(delivery).deliver(new DeliveryTarget("qq", "Group:456"), "Today's news");

    ArgumentCaptor<List<ChatMessage>> transcript = ArgumentCaptor.forClass(List.class);
    verify(loop).run(any(), transcript.capture(), anyInt(), any());
    assertEquals(List.of(ChatMessage.system("You are a news reporter."), ChatMessage.user("Summarize today's news.")),
                 transcript.getValue());
  }

  @Test
  void testDeliveryFailureDoesNotStopOtherTargets() throws Exception {
    when(loop.run(any(), anyList(), anyInt(), any())).thenReturn(new ConversationResult("News", List.of(), 1));
    doThrow(new DeliveryException("adapter offline")).when(delivery).deliver(eq(DeliveryTarget.parse("telegram:12345")), anyString());

    int delivered = scheduler(10).fire(BroadcastScheduler.parseTargets(config.getPushTargets()));

    assertEquals(1, delivered);
    verify(delivery).deliver(eq(new DeliveryTarget("qq", "Group:456")), eq("News"));
  }

  @Test
  void testUnexpectedDeliveryErrorDoesNotStopOtherTargets() throws Exception {
    when(loop.run(any(), anyList(), anyInt(), any())).thenReturn(new ConversationResult("News", List.of(), 1));
    doThrow(new IllegalStateException("adapter misconfigured")).when(delivery).deliver(eq(DeliveryTarget.parse("telegram:12345")), anyString());

    int delivered = scheduler(10).fire(BroadcastScheduler.parseTargets(config.getPushTargets()));

    assertEquals(1, delivered);
    verify(delivery).deliver(eq(new DeliveryTarget("qq", "Group:456")), eq("News"));
  }

  @Test
  void testUnexpectedConversationErrorKeepsLoopAlive() throws Exception {
    when(loop.run(any(), anyList(), anyInt(), any()))
        .thenThrow(new IllegalStateException("malformed response"))
        .thenReturn(new ConversationResult("News", List.of(), 1));

    scheduler(4).runLoop();

    assertEquals(4, sleeps.size());
    verify(loop, times(2)).run(any(), anyList(), anyInt(), any());
    verify(delivery, times(2)).deliver(any(), eq("News"));
  }

  @Test
  void testEmptyAnswerNotDelivered() throws Exception {
    when(loop.run(any(), anyList(), anyInt(), any())).thenReturn(new ConversationResult("  ", List.of(), 1));

    assertEquals(0, scheduler(10).fire(BroadcastScheduler.parseTargets(config.getPushTargets())));
    verifyNoInteractions(delivery);
  }

  @Test
  void testConversationFailureNotDelivered() throws Exception {
    when(loop.run(any(), anyList(), anyInt(), any())).thenThrow(new GenerationException("model down"));

    assertEquals(0, scheduler(10).fire(BroadcastScheduler.parseTargets(config.getPushTargets())));
    verifyNoInteractions(delivery);
  }

  @Test
  void testLoopSleepsUntilFireTimeThenGuardDelay() throws Exception {
    when(loop.run(any(), anyList(), anyInt(), any())).thenReturn(new ConversationResult("News", List.of(), 1));

    scheduler(2).runLoop();

    assertEquals(List.of(Duration.ofMinutes(30), BroadcastScheduler.GUARD_DELAY), sleeps);
    verify(loop, times(1)).run(any(), anyList(), anyInt(), any());
    verify(delivery, times(2)).deliver(any(), eq("News"));
  }

  @Test
  void testInvalidTimeExitsLoop() {
    when(config.getPushTime()).thenReturn("25:99");

    scheduler(10).runLoop();

    assertTrue(sleeps.isEmpty());
    verifyNoInteractions(loop);
  }

  @Test
  void testMalformedTargetsSkipped() {
    List<DeliveryTarget> targets = BroadcastScheduler.parseTargets(List.of("telegram:1", "broken", "qq:2"));

    assertEquals(List.of(new DeliveryTarget("telegram", "1"), new DeliveryTarget("qq", "2")), targets);
  }

  @Test
  void testDisabledSchedulerNotStarted() {
    when(config.isPushEnabled()).thenReturn(false);
    BroadcastScheduler scheduler = scheduler(10);

    scheduler.onStartup(new Object());

    assertFalse(scheduler.isRunning());
  }
}
