package org.moxie.toolchat.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import org.moxie.toolchat.mcp.ToolSessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only view of the merged tool catalog and provider health.
 */
@ApplicationScoped
@Path("/v1/tools")
public class ToolsController {

  private static final Logger log = LoggerFactory.getLogger(ToolsController.class);

  private final ToolSessionRegistry registry;
  private final ObjectMapper        mapper;

  @Inject
  public ToolsController(ToolSessionRegistry registry, ObjectMapper mapper) {
    this.registry = registry;
    this.mapper   = mapper;
  }

  @GET
  @Produces(MediaType.APPLICATION_JSON)
  public String getTools() {
    return write(registry.listTools());
  }

  @GET
  @Path("/health")
  @Produces(MediaType.APPLICATION_JSON)
  public String getHealth() {
    return write(registry.healthCheck());
  }

  private String write(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize response", e);
      throw new WebApplicationException("Failed to serialize response", 500);
    }
  }
}
