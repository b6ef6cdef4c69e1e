package org.moxie.toolchat.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.ws.rs.WebApplicationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.moxie.toolchat.conversation.AccessDeniedException;
import org.moxie.toolchat.conversation.ConversationMode;
import org.moxie.toolchat.conversation.ConversationRequest;
import org.moxie.toolchat.conversation.ConversationResult;
import org.moxie.toolchat.conversation.ConversationService;
import org.moxie.toolchat.conversation.ConversationTimeoutException;
import org.moxie.toolchat.conversation.GenerationException;
import org.moxie.toolchat.conversation.IterationsExceededException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationControllerTest {

  private static final String BODY = "{\"platform\":\"telegram\",\"userId\":\"42\",\"text\":\"hello\",\"mode\":\"chat\"}";

  @Mock
  private ConversationService conversationService;

  private final ObjectMapper mapper = new ObjectMapper();

  private ConversationController controller;

  @BeforeEach
  void setUp() {
    controller = new ConversationController(conversationService, mapper);
  }

  @Test
  void converse_validRequest_returnsText() throws Exception {
    when(conversationService.converse(new ConversationRequest("telegram", "42", "hello", ConversationMode.CHAT)))
        .thenReturn(new ConversationResult("Hi there", List.of(), 1));

    String response = controller.converse(BODY);

    assertEquals("Hi there", mapper.readTree(response).get("text").asText());
  }

  @Test
  void converse_newsMode_parsed() throws Exception {
    when(conversationService.converse(new ConversationRequest("qq", "1", null, ConversationMode.NEWS)))
        .thenReturn(new ConversationResult("Headlines", List.of(), 1));

    String response = controller.converse("{\"platform\":\"qq\",\"userId\":\"1\",\"mode\":\"news\"}");

    assertEquals("Headlines", mapper.readTree(response).get("text").asText());
  }

  @Test
  void converse_errors_mapToStatusCodes() throws Exception {
    when(conversationService.converse(any()))
        .thenThrow(new AccessDeniedException("telegram", "42"))
        .thenThrow(new ConversationTimeoutException("too slow"))
        .thenThrow(new IterationsExceededException(5, List.of()))
        .thenThrow(new GenerationException("model down"))
        .thenThrow(new IllegalArgumentException("text is required"));

    assertEquals(403, status(() -> controller.converse(BODY)));
    assertEquals(504, status(() -> controller.converse(BODY)));
    assertEquals(508, status(() -> controller.converse(BODY)));
    assertEquals(502, status(() -> controller.converse(BODY)));
    assertEquals(400, status(() -> controller.converse(BODY)));
  }

  @Test
  void converse_malformedBody_returns400() {
    assertEquals(400, status(() -> controller.converse("{oops")));
    assertEquals(400, status(() -> controller.converse("")));
    assertEquals(400, status(() -> controller.converse("{\"platform\":\"qq\",\"userId\":\"1\",\"mode\":\"poetry\"}")));
    verifyNoInteractions(conversationService);
  }

  private static int status(Runnable call) {
    WebApplicationException e = assertThrows(WebApplicationException.class, call::run);
    return e.getResponse().getStatus();
  }
}
