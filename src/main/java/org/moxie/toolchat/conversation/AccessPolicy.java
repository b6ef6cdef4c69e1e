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
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides which users may start conversations. Each platform has its own list, where
 * {@code "*"} admits everyone; the legacy list admits its ids on every platform.
 * Anyone else is denied.
 */
@ApplicationScoped
public class AccessPolicy {

  private static final Logger log = LoggerFactory.getLogger(AccessPolicy.class);

  static final String WILDCARD = "*";

  private final Map<String, Set<String>> platformUsers;
  private final Set<String>              legacyUsers;

  @Inject
  public AccessPolicy(Config config, ObjectMapper mapper) {
    this(parse(mapper, config.getAllowedUsers()), config.getLegacyAllowedUsers());
  }

  public AccessPolicy(Map<String, List<String>> platformUsers, List<String> legacyUsers) {
    this.platformUsers = new HashMap<>();
    this.legacyUsers   = Set.copyOf(legacyUsers);

    platformUsers.forEach((platform, users) -> this.platformUsers.put(platform.toLowerCase(Locale.ROOT), Set.copyOf(users)));
  }

  public boolean isAllowed(String platform, String userId) {
    Set<String> allowed = platformUsers.get(platform.toLowerCase(Locale.ROOT));

    if (allowed != null && (allowed.contains(WILDCARD) || allowed.contains(userId))) {
      return true;
    }

    return legacyUsers.contains(userId);
  }

  private static Map<String, List<String>> parse(ObjectMapper mapper, String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }

    try {
      return mapper.readValue(json, new TypeReference<Map<String, List<String>>>() {});
    } catch (JsonProcessingException e) {
      log.error("Invalid access.allowed_users configuration, only legacy users are admitted", e);
      return Map.of();
    }
  }
}
