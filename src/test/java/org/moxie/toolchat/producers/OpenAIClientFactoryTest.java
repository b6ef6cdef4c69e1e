package org.moxie.toolchat.producers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OpenAIClientFactoryTest {

  @Test
  void testNormalizeBaseUrl() {
    assertEquals("https://api.openai.com/v1/", OpenAIClientFactory.normalizeBaseUrl("https://api.openai.com/v1"));
    assertEquals("https://api.openai.com/v1/", OpenAIClientFactory.normalizeBaseUrl("https://api.openai.com/v1/"));
    assertEquals("https://api.deepseek.com/v1/", OpenAIClientFactory.normalizeBaseUrl(" https://api.deepseek.com/v1/chat/completions "));
  }

  @Test
  void testBlankBaseUrlRejected() {
    assertThrows(IllegalArgumentException.class, () -> OpenAIClientFactory.normalizeBaseUrl(" "));
    assertThrows(IllegalArgumentException.class, () -> OpenAIClientFactory.normalizeBaseUrl(null));
  }
}
