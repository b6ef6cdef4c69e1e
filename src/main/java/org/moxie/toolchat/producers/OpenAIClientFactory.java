package org.moxie.toolchat.producers;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.moxie.toolchat.llm.AiConfig;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out OpenAI-compatible clients, one per base URL and API key, since a user
 * override may point at a different endpoint than the static default.
 */
@ApplicationScoped
public class OpenAIClientFactory {

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(120);

  private final Map<String, OpenAIClient> clients = new ConcurrentHashMap<>();

  public OpenAIClient clientFor(AiConfig aiConfig) {
    String baseUrl = normalizeBaseUrl(aiConfig.baseUrl());
    String apiKey  = aiConfig.apiKey() == null || aiConfig.apiKey().isBlank() ? "dummy" : aiConfig.apiKey();

    return clients.computeIfAbsent(baseUrl + "\n" + apiKey, key -> OpenAIOkHttpClient.builder()
                                                                                      .apiKey(apiKey)
                                                                                      .baseUrl(baseUrl)
                                                                                      .timeout(REQUEST_TIMEOUT)
                                                                                      .build());
  }

  @PreDestroy
  void shutdown() {
    clients.values().forEach(OpenAIClient::close);
    clients.clear();
  }

  /**
   * Accept base URLs given with or without the chat completions path.
   */
  static String normalizeBaseUrl(String baseUrl) {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("AI base URL is not configured");
    }

    String normalized = baseUrl.trim();

    if (normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }

    if (normalized.endsWith("/chat/completions")) {
      normalized = normalized.substring(0, normalized.length() - "/chat/completions".length());
    }

    return normalized + "/";
  }
}
