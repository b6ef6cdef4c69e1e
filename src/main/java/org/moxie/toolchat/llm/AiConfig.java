package org.moxie.toolchat.llm;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Coordinates of the model endpoint used for one conversation.
 */
public record AiConfig(
    @JsonProperty("provider") String provider,
    @JsonProperty("base_url") String baseUrl,
    @JsonProperty("api_key") String apiKey,
    @JsonProperty("model") String model,
    @JsonProperty("default_prompt") String defaultPrompt
) {

  /**
   * Apply one {@code key=value} setting. Unknown keys leave the config unchanged.
   */
  public AiConfig with(String key, String value) {
    return switch (key.toLowerCase(Locale.ROOT)) {
      case "key", "api_key"  -> new AiConfig(provider, baseUrl, value, model, defaultPrompt);
      case "model"           -> new AiConfig(provider, baseUrl, apiKey, value, defaultPrompt);
      case "url", "base_url" -> new AiConfig(provider, value, apiKey, model, defaultPrompt);
      case "provider"        -> new AiConfig(value, baseUrl, apiKey, model, defaultPrompt);
      default                -> this;
    };
  }

  @Override
  public String toString() {
    return "AiConfig[provider=" + provider + ", baseUrl=" + baseUrl + ", model=" + model + "]";
  }
}
