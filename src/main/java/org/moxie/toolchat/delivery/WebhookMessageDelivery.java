package org.moxie.toolchat.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.moxie.toolchat.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Hands messages to platform adapters by POSTing {@code {"recipient", "text"}} to the
 * webhook configured for the target's platform.
 */
@ApplicationScoped
public class WebhookMessageDelivery implements MessageDelivery {

  private static final Logger log = LoggerFactory.getLogger(WebhookMessageDelivery.class);

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final HttpClient          httpClient;
  private final ObjectMapper        mapper;
  private final Map<String, String> webhooks;

  @Inject
  public WebhookMessageDelivery(Config config, HttpClient httpClient, ObjectMapper mapper) {
    this(httpClient, mapper, parseWebhooks(mapper, config.getDeliveryWebhooks()));
  }

  public WebhookMessageDelivery(HttpClient httpClient, ObjectMapper mapper, Map<String, String> webhooks) {
    this.httpClient = httpClient;
    this.mapper     = mapper;
    this.webhooks   = new LinkedHashMap<>();
    webhooks.forEach((platform, url) -> this.webhooks.put(platform.toLowerCase(Locale.ROOT), url));
  }

  @Override
  public void deliver(DeliveryTarget target, String text) throws DeliveryException {
    String webhook = webhooks.get(target.platform());

    if (webhook == null) {
      throw new DeliveryException("No delivery webhook configured for platform: " + target.platform());
    }

    String body;
    try {
      body = mapper.writeValueAsString(Map.of("recipient", target.recipient(), "text", text));
    } catch (JsonProcessingException e) {
      throw new DeliveryException("Failed to serialize message for " + target, e);
    }

    HttpRequest request;
    try {
      request = HttpRequest.newBuilder(URI.create(webhook))
                           .timeout(REQUEST_TIMEOUT)
                           .header("Content-Type", "application/json")
                           .POST(HttpRequest.BodyPublishers.ofString(body))
                           .build();
    } catch (IllegalArgumentException e) {
      throw new DeliveryException("Invalid delivery webhook for platform " + target.platform() + ": " + webhook, e);
    }

    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        throw new DeliveryException("Delivery to " + target + " failed with status " + response.statusCode() + ": " + response.body());
      }

      log.info("Delivered message to {}", target);
    } catch (IOException e) {
      throw new DeliveryException("Delivery to " + target + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DeliveryException("Delivery to " + target + " interrupted", e);
    }
  }

  static Map<String, String> parseWebhooks(ObjectMapper mapper, String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }

    try {
      return mapper.readValue(json, new TypeReference<Map<String, String>>() {});
    } catch (JsonProcessingException e) {
      log.error("Invalid delivery.webhooks configuration, no platforms will receive messages", e);
      return Map.of();
    }
  }
}
