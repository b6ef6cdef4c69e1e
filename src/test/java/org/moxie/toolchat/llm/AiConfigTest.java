package org.moxie.toolchat.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AiConfigTest {

  private static final AiConfig BASE = new AiConfig("openai", "https://api.openai.com/v1", "sk-1", "gpt-4o-mini", "Be helpful.");

  @Test
  void testWithAcceptsAliases() {
    assertEquals("sk-2", BASE.with("KEY", "sk-2").apiKey());
    assertEquals("sk-3", BASE.with("api_key", "sk-3").apiKey());
    assertEquals("http://local/v1", BASE.with("url", "http://local/v1").baseUrl());
    assertEquals("http://other/v1", BASE.with("base_url", "http://other/v1").baseUrl());
    assertEquals("deepseek", BASE.with("provider", "deepseek").provider());
    assertEquals("gpt-4o", BASE.with("model", "gpt-4o").model());
  }

  @Test
  void testWithIgnoresUnknownKeys() {
    assertSame(BASE, BASE.with("temperature", "0.2"));
  }

  @Test
  void testToStringHidesApiKey() {
    assertFalse(BASE.toString().contains("sk-1"));
  }

  @Test
  void testJsonUsesSnakeCaseNames() throws Exception {
    ObjectMapper mapper = new ObjectMapper();

    String json = mapper.writeValueAsString(BASE);

    assertTrue(json.contains("\"base_url\""));
    assertTrue(json.contains("\"api_key\""));
    assertEquals(BASE, mapper.readValue(json, AiConfig.class));
  }
}
