package org.moxie.toolchat.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import org.moxie.toolchat.conversation.ConversationService;
import org.moxie.toolchat.llm.AiConfig;
import org.moxie.toolchat.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-user model endpoint overrides.
 */
@ApplicationScoped
@Path("/v1/users/{platform}/{userId}/ai")
public class UserSettingsController {

  private static final Logger log = LoggerFactory.getLogger(UserSettingsController.class);

  public record SettingsBody(String args) {}

  private final ConversationService conversationService;
  private final ObjectMapper        mapper;

  @Inject
  public UserSettingsController(ConversationService conversationService, ObjectMapper mapper) {
    this.conversationService = conversationService;
    this.mapper              = mapper;
  }

  @PUT
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public String update(@PathParam("platform") String platform, @PathParam("userId") String userId, String body) {
    try {
      SettingsBody settings = mapper.readValue(body == null || body.isBlank() ? "{}" : body, SettingsBody.class);
      AiConfig     updated  = conversationService.updateAiSettings(platform, userId, settings.args());

      Map<String, String> response = new LinkedHashMap<>();
      response.put("provider", updated.provider());
      response.put("base_url", updated.baseUrl());
      response.put("model", updated.model());

      return mapper.writeValueAsString(response);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new WebApplicationException("Invalid request: " + e.getMessage(), 400);
    } catch (StorageException e) {
      log.error("Failed to save AI settings for {}:{}", platform, userId, e);
      throw new WebApplicationException("Failed to save settings", 500);
    }
  }

  @DELETE
  public void reset(@PathParam("platform") String platform, @PathParam("userId") String userId) {
    try {
      conversationService.resetAiSettings(platform, userId);
    } catch (StorageException e) {
      log.error("Failed to reset AI settings for {}:{}", platform, userId, e);
      throw new WebApplicationException("Failed to reset settings", 500);
    }
  }
}
