package org.moxie.toolchat.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.moxie.toolchat.config.Config;
import org.moxie.toolchat.llm.AiConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps user overrides in memory and rewrites the whole JSON file after every change.
 */
@ApplicationScoped
public class JsonFileUserSettingsStore implements UserSettingsStore {

  private static final Logger log = LoggerFactory.getLogger(JsonFileUserSettingsStore.class);

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record UserSettings(@JsonProperty("override_ai") AiConfig overrideAi) {}

  record StorageFile(@JsonProperty("user_data") Map<String, UserSettings> userData) {}

  private final ReadWriteLock             lock     = new ReentrantReadWriteLock();
  private final Map<String, UserSettings> userData = new LinkedHashMap<>();

  private final Path         path;
  private final ObjectMapper mapper;

  @Inject
  public JsonFileUserSettingsStore(Config config, ObjectMapper mapper) {
    this(Path.of(config.getStoragePath()), mapper);
  }

  public JsonFileUserSettingsStore(Path path, ObjectMapper mapper) {
    this.path   = path;
    this.mapper = mapper;
    load();
  }

  private void load() {
    if (!Files.exists(path)) {
      log.info("No user settings file at {}, starting empty", path);
      return;
    }

    try {
      byte[] data = Files.readAllBytes(path);

      if (data.length == 0) {
        return;
      }

      StorageFile file = mapper.readValue(data, StorageFile.class);

      if (file.userData() != null) {
        userData.putAll(file.userData());
      }

      log.info("Loaded settings for {} user(s) from {}", userData.size(), path);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read user settings from " + path, e);
    }
  }

  @Override
  public Optional<AiConfig> getOverride(String key) {
    lock.readLock().lock();
    try {
      UserSettings settings = userData.get(key);
      return settings == null ? Optional.empty() : Optional.ofNullable(settings.overrideAi());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void setOverride(String key, AiConfig aiConfig) throws StorageException {
    lock.writeLock().lock();
    try {
      UserSettings previous = userData.put(key, new UserSettings(aiConfig));

      try {
        save();
      } catch (StorageException e) {
        restore(key, previous);
        throw e;
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void clearOverride(String key) throws StorageException {
    lock.writeLock().lock();
    try {
      UserSettings previous = userData.remove(key);

      if (previous != null) {
        try {
          save();
        } catch (StorageException e) {
          restore(key, previous);
          throw e;
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void restore(String key, UserSettings previous) {
    if (previous == null) {
      userData.remove(key);
    } else {
      userData.put(key, previous);
    }
  }

  private void save() throws StorageException {
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }

      Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
      mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new StorageFile(userData));

      try {
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      log.error("Failed to save user settings to {}", path, e);
      throw new StorageException("Failed to save user settings", e);
    }
  }
}
