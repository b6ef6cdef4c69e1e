package org.moxie.toolchat.storage;

import org.moxie.toolchat.llm.AiConfig;

import java.util.Optional;

/**
 * Per-user model endpoint overrides, keyed by {@code platform:userId}.
 */
public interface UserSettingsStore {

  Optional<AiConfig> getOverride(String key);

  void setOverride(String key, AiConfig aiConfig) throws StorageException;

  void clearOverride(String key) throws StorageException;

  static String key(String platform, String userId) {
    return platform + ":" + userId;
  }
}
