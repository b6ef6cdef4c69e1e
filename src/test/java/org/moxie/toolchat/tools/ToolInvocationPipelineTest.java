package org.moxie.toolchat.tools;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.moxie.toolchat.mcp.McpServerConfig;
import org.moxie.toolchat.mcp.ToolProviderConnection;
import org.moxie.toolchat.mcp.ToolProviderException;
import org.moxie.toolchat.mcp.ToolSession;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ToolInvocationPipelineTest {

  @Mock
  private ToolProviderConnection connection;

  private List<Duration>         sleeps;
  private ToolSession            session;
  private ToolInvocationPipeline pipeline;

  @BeforeEach
  void setUp() {
    sleeps   = new ArrayList<>();
    session  = new ToolSession("search", new McpServerConfig("search", null, "http://localhost/mcp", null, null, null, null, false),
                               connection, Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
    pipeline = new ToolInvocationPipeline(RetryPolicy.DEFAULT, sleeps::add);
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void testFirstAttemptSucceeds() throws Exception {
    when(connection.callTool(eq("web_search"), anyMap(), eq(Duration.ofSeconds(60)))).thenReturn("results");

    assertEquals("results", pipeline.invoke(session, "web_search", Map.of("q", "java")));
    assertTrue(sleeps.isEmpty());
    assertEquals(0, session.getConsecutiveFailures());
  }

  @Test
  void testRetrySucceedsAfterBackoff() throws Exception {
    when(connection.callTool(eq("web_search"), anyMap(), any()))
        .thenThrow(new ToolProviderException("connection reset"))
        .thenReturn("results");

    assertEquals("results", pipeline.invoke(session, "web_search", Map.of()));
    assertEquals(List.of(Duration.ofMillis(500)), sleeps);
    assertEquals(0, session.getConsecutiveFailures());
  }

  @Test
  void testExhaustedRetriesRecordOneFailure() throws Exception {
    ToolProviderException last = new ToolProviderException("still down");
    when(connection.callTool(eq("web_search"), anyMap(), any()))
        .thenThrow(new ToolProviderException("down"))
        .thenThrow(last);

    ToolInvocationException e = assertThrows(ToolInvocationException.class, () -> pipeline.invoke(session, "web_search", Map.of()));

    assertEquals(2, e.getAttempts());
    assertSame(last, e.getCause());
    assertEquals("web_search", e.getToolName());
    assertEquals(1, session.getConsecutiveFailures());
  }

  @Test
  void testSuccessResetsFailureCount() throws Exception {
    session.recordFailure();
    session.recordFailure();
    when(connection.callTool(eq("web_search"), anyMap(), any())).thenReturn("ok");

    pipeline.invoke(session, "web_search", Map.of());

    assertEquals(0, session.getConsecutiveFailures());
  }

  @Test
  void testClosedSessionNeverCalled() throws Exception {
    session.close();

    assertThrows(SessionClosedException.class, () -> pipeline.invoke(session, "web_search", Map.of()));
    verify(connection, never()).callTool(any(), anyMap(), any());
    assertEquals(0, session.getConsecutiveFailures());
  }

  @Test
  void testSessionClosedDuringRetry() throws Exception {
    when(connection.callTool(eq("web_search"), anyMap(), any())).thenThrow(new ToolProviderException("closing"));
    ToolInvocationPipeline closingPipeline = new ToolInvocationPipeline(RetryPolicy.DEFAULT, delay -> session.close());

    assertThrows(SessionClosedException.class, () -> closingPipeline.invoke(session, "web_search", Map.of()));
    verify(connection, times(1)).callTool(eq("web_search"), anyMap(), any());
  }

  @Test
  void testInterruptedBackoffNotCountedAsFailure() throws Exception {
    when(connection.callTool(eq("web_search"), anyMap(), any())).thenThrow(new ToolProviderException("slow"));
    ToolInvocationPipeline cancelledPipeline = new ToolInvocationPipeline(RetryPolicy.DEFAULT, delay -> {
      throw new InterruptedException("deadline");
    });

    assertThrows(ToolInvocationException.class, () -> cancelledPipeline.invoke(session, "web_search", Map.of()));

    assertTrue(Thread.currentThread().isInterrupted());
    assertEquals(0, session.getConsecutiveFailures());
  }

  @Test
  void testInterruptedAttemptNotCountedAsFailure() throws Exception {
    when(connection.callTool(eq("web_search"), anyMap(), any())).thenAnswer(invocation -> {
      Thread.currentThread().interrupt();
      throw new ToolProviderException("tools/call web_search interrupted");
    });

    assertThrows(ToolInvocationException.class, () -> pipeline.invoke(session, "web_search", Map.of()));

    verify(connection, times(1)).callTool(eq("web_search"), anyMap(), any());
    assertEquals(0, session.getConsecutiveFailures());
  }

  @Test
  void testBackoffGrowsLinearly() {
    RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(500), Duration.ofSeconds(1));

    assertEquals(Duration.ZERO, policy.backoffBefore(0));
    assertEquals(Duration.ofMillis(1000), policy.backoffBefore(2));
    assertEquals(Duration.ofMillis(1500), policy.backoffBefore(3));
  }

  @Test
  void testInvalidPolicyRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO));
  }
}
