package org.moxie.toolchat.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.moxie.toolchat.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Per-platform formatting instructions and per-user personas.
 */
@ApplicationScoped
public class PromptCatalog {

  private static final Logger log = LoggerFactory.getLogger(PromptCatalog.class);

  private final Map<String, String>  platformPrompts;
  private final Map<String, Persona> personas;

  @Inject
  public PromptCatalog(Config config, ObjectMapper mapper) {
    this(parse(mapper, config.getPlatformPrompts(), new TypeReference<Map<String, String>>() {}, "ai.platform_prompts"),
         parse(mapper, config.getPersonas(), new TypeReference<Map<String, Persona>>() {}, "ai.personas"));
  }

  public PromptCatalog(Map<String, String> platformPrompts, Map<String, Persona> personas) {
    this.platformPrompts = new HashMap<>();
    this.personas        = Map.copyOf(personas);

    platformPrompts.forEach((platform, prompt) -> this.platformPrompts.put(platform.toLowerCase(Locale.ROOT), prompt));
  }

  /**
   * Instruction used to restyle final answers for the platform, or null if it has none.
   */
  public String formattingInstruction(String platform) {
    if (platform == null) {
      return null;
    }
    return platformPrompts.get(platform.toLowerCase(Locale.ROOT));
  }

  /**
   * @param key {@code platform:userId}
   */
  public Optional<Persona> persona(String key) {
    Persona persona = personas.get(key);

    if (persona == null || persona.prompt() == null || persona.prompt().isBlank()) {
      return Optional.empty();
    }

    return Optional.of(persona);
  }

  private static <T> Map<String, T> parse(ObjectMapper mapper, String json, TypeReference<Map<String, T>> type, String property) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }

    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      log.error("Invalid {} configuration, ignoring it", property, e);
      return Map.of();
    }
  }
}
