package org.moxie.toolchat.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.moxie.toolchat.config.Config;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PromptCatalogTest {

  @Test
  void testReadsPlatformPromptsAndPersonas() {
    Config config = mock(Config.class);
    when(config.getPlatformPrompts()).thenReturn("{\"Telegram\": \"Use Markdown.\"}");
    when(config.getPersonas()).thenReturn("{\"QQ:ABC123\": {\"name\": \"Mia\", \"prompt\": \"You are Mia.\"}}");

    PromptCatalog catalog = new PromptCatalog(config, new ObjectMapper());

    assertEquals("Use Markdown.", catalog.formattingInstruction("telegram"));
    assertNull(catalog.formattingInstruction("qq"));
    assertEquals("Mia", catalog.persona("QQ:ABC123").orElseThrow().name());
    assertTrue(catalog.persona("QQ:other").isEmpty());
  }

  @Test
  void testBlankPersonaPromptIgnored() {
    PromptCatalog catalog = new PromptCatalog(Map.of(), Map.of("qq:1", new Persona("Empty", " ")));

    assertTrue(catalog.persona("qq:1").isEmpty());
  }

  @Test
  void testMissingOrInvalidConfigurationIsEmpty() {
    Config config = mock(Config.class);
    when(config.getPlatformPrompts()).thenReturn("not json");

    PromptCatalog catalog = new PromptCatalog(config, new ObjectMapper());

    assertNull(catalog.formattingInstruction("telegram"));
    assertTrue(catalog.persona("qq:1").isEmpty());
  }
}
