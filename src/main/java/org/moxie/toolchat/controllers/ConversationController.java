package org.moxie.toolchat.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import org.moxie.toolchat.conversation.AccessDeniedException;
import org.moxie.toolchat.conversation.ConversationException;
import org.moxie.toolchat.conversation.ConversationMode;
import org.moxie.toolchat.conversation.ConversationRequest;
import org.moxie.toolchat.conversation.ConversationResult;
import org.moxie.toolchat.conversation.ConversationService;
import org.moxie.toolchat.conversation.ConversationTimeoutException;
import org.moxie.toolchat.conversation.IterationsExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

@ApplicationScoped
@Path("/v1/conversations")
public class ConversationController {

  private static final Logger log = LoggerFactory.getLogger(ConversationController.class);

  /**
   * Request body: {@code {"platform", "userId", "text", "mode"}}.
   */
  public record ConversationBody(String platform, String userId, String text, String mode) {}

  private final ConversationService conversationService;
  private final ObjectMapper        mapper;

  @Inject
  public ConversationController(ConversationService conversationService, ObjectMapper mapper) {
    this.conversationService = conversationService;
    this.mapper              = mapper;
  }

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public String converse(String body) {
    ConversationRequest request = parseRequest(body);

    try {
      ConversationResult result = conversationService.converse(request);
      return mapper.writeValueAsString(Map.of("text", result.finalText() == null ? "" : result.finalText()));
    } catch (AccessDeniedException e) {
      throw new WebApplicationException(e.getMessage(), 403);
    } catch (ConversationTimeoutException e) {
      throw new WebApplicationException(e.getMessage(), 504);
    } catch (IterationsExceededException e) {
      throw new WebApplicationException(e.getMessage(), 508);
    } catch (ConversationException e) {
      log.warn("Conversation failed for {}:{}: {}", request.platform(), request.userId(), e.getMessage());
      throw new WebApplicationException(e.getMessage(), 502);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), 400);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize response", e);
      throw new WebApplicationException("Failed to serialize response", 500);
    }
  }

  private ConversationRequest parseRequest(String body) {
    if (body == null || body.isBlank()) {
      throw new WebApplicationException("Request body is required", 400);
    }

    try {
      ConversationBody parsed = mapper.readValue(body, ConversationBody.class);
      return new ConversationRequest(parsed.platform(), parsed.userId(), parsed.text(), ConversationMode.fromString(parsed.mode()));
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new WebApplicationException("Invalid request: " + e.getMessage(), 400);
    }
  }
}
