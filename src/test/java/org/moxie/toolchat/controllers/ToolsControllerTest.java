package org.moxie.toolchat.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.moxie.toolchat.mcp.ToolSessionRegistry;
import org.moxie.toolchat.tools.ToolDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ToolsControllerTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void testListsCatalogAndHealth() throws Exception {
    ToolSessionRegistry registry = mock(ToolSessionRegistry.class);
    when(registry.listTools()).thenReturn(List.of(new ToolDefinition("web_search", "Search the web", mapper.createObjectNode().put("type", "object"))));
    Map<String, Boolean> health = new LinkedHashMap<>();
    health.put("search", true);
    health.put("files", false);
    when(registry.healthCheck()).thenReturn(health);

    ToolsController controller = new ToolsController(registry, mapper);

    JsonNode tools = mapper.readTree(controller.getTools());
    assertEquals("web_search", tools.get(0).get("name").asText());
    assertEquals("object", tools.get(0).get("parameterSchema").get("type").asText());

    JsonNode healthJson = mapper.readTree(controller.getHealth());
    assertTrue(healthJson.get("search").asBoolean());
    assertFalse(healthJson.get("files").asBoolean());
  }

  @Test
  void testPing() {
    assertEquals("PONG", new PingController().getPing());
  }
}
