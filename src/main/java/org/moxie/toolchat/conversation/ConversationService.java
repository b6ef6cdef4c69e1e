package org.moxie.toolchat.conversation;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.moxie.toolchat.config.Config;
import org.moxie.toolchat.llm.AiConfig;
import org.moxie.toolchat.llm.ChatMessage;
import org.moxie.toolchat.storage.StorageException;
import org.moxie.toolchat.storage.UserSettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for user-triggered conversations. Resolves who is asking, which endpoint
 * and prompt apply to them, and runs the loop under the end-to-end deadline.
 */
@ApplicationScoped
public class ConversationService {

  private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

  static final String NEWS_REQUEST = "Search for today's latest news, summarize the key points and list the specific events.";

  private final Config            config;
  private final ConversationLoop  conversationLoop;
  private final UserSettingsStore settingsStore;
  private final PromptCatalog     promptCatalog;
  private final AccessPolicy      accessPolicy;
  private final ExecutorService   executor;

  @Inject
  public ConversationService(Config config, ConversationLoop conversationLoop, UserSettingsStore settingsStore,
                             PromptCatalog promptCatalog, AccessPolicy accessPolicy)
  {
    this.config           = config;
    this.conversationLoop = conversationLoop;
    this.settingsStore    = settingsStore;
    this.promptCatalog    = promptCatalog;
    this.accessPolicy     = accessPolicy;
    this.executor         = Executors.newCachedThreadPool(new ConversationThreadFactory());
  }

  @PreDestroy
  void shutdown() {
    executor.shutdownNow();
  }

  /**
   * Run one conversation for the request.
   *
   * @throws AccessDeniedException        if the user is not on the allow-list
   * @throws ConversationTimeoutException if the run does not finish within the deadline
   * @throws IllegalArgumentException     if a chat or search request carries no text
   */
  public ConversationResult converse(ConversationRequest request) throws ConversationException {
    if (!accessPolicy.isAllowed(request.platform(), request.userId())) {
      log.info("Ignoring request from {} on {}: not allowed", request.userId(), request.platform());
      throw new AccessDeniedException(request.platform(), request.userId());
    }

    String            key        = UserSettingsStore.key(request.platform(), request.userId());
    AiConfig          aiConfig   = effectiveAiConfig(key);
    List<ChatMessage> transcript = seedTranscript(request, key, aiConfig);
    String            formatting = promptCatalog.formattingInstruction(request.platform());

    log.info("Starting {} conversation for {} (model: {})", request.mode(), key, aiConfig.model());

    return runWithDeadline(aiConfig, transcript, formatting);
  }

  /**
   * Apply {@code key=value} settings on top of the user's current endpoint and persist
   * the result as their override. Unknown keys and tokens without {@code =} are ignored.
   */
  public AiConfig updateAiSettings(String platform, String userId, String args) throws StorageException {
    if (args == null || args.isBlank()) {
      throw new IllegalArgumentException("usage: key=<api key> model=<model> url=<base url> provider=<provider>");
    }

    String   key     = UserSettingsStore.key(platform, userId);
    AiConfig updated = effectiveAiConfig(key);

    for (String token : args.trim().split("\\s+")) {
      int separator = token.indexOf('=');

      if (separator <= 0) {
        continue;
      }

      updated = updated.with(token.substring(0, separator), token.substring(separator + 1));
    }

    settingsStore.setOverride(key, updated);
    log.info("Updated AI settings for {}: {}", key, updated);

    return updated;
  }

  public void resetAiSettings(String platform, String userId) throws StorageException {
    String key = UserSettingsStore.key(platform, userId);
    settingsStore.clearOverride(key);
    log.info("Reset AI settings for {}", key);
  }

  AiConfig effectiveAiConfig(String key) {
    return settingsStore.getOverride(key).orElseGet(config::getDefaultAiConfig);
  }

  List<ChatMessage> seedTranscript(ConversationRequest request, String key, AiConfig aiConfig) {
    switch (request.mode()) {
      case NEWS:
        return List.of(ChatMessage.system(config.getNewsPrompt()), ChatMessage.user(NEWS_REQUEST));
      case SEARCH:
        return List.of(ChatMessage.system(config.getSearchPrompt()), ChatMessage.user(requireText(request)));
      default:
        return List.of(ChatMessage.system(chatSystemPrompt(key, aiConfig)), ChatMessage.user(requireText(request)));
    }
  }

  private String chatSystemPrompt(String key, AiConfig aiConfig) {
    Optional<Persona> persona = promptCatalog.persona(key);

    if (persona.isPresent()) {
      log.debug("Using persona {} for {}", persona.get().name(), key);
      return persona.get().prompt();
    }

    if (aiConfig.defaultPrompt() != null && !aiConfig.defaultPrompt().isBlank()) {
      return aiConfig.defaultPrompt();
    }

    return config.getAiDefaultPrompt();
  }

  private static String requireText(ConversationRequest request) {
    if (request.text() == null || request.text().isBlank()) {
      throw new IllegalArgumentException("text is required for " + request.mode().name().toLowerCase(Locale.ROOT) + " conversations");
    }
    return request.text();
  }

  private ConversationResult runWithDeadline(AiConfig aiConfig, List<ChatMessage> transcript, String formatting)
      throws ConversationException
  {
    Duration                   deadline = Duration.ofSeconds(config.getRunTimeoutSeconds());
    Future<ConversationResult> future   = executor.submit(() -> conversationLoop.run(aiConfig, transcript, config.getMaxIterations(), formatting));

    try {
      return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Conversation exceeded its {}s deadline and was cancelled", deadline.toSeconds());
      throw new ConversationTimeoutException("conversation did not finish within " + deadline.toSeconds() + "s", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ConversationTimeoutException("conversation interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();

      if (cause instanceof ConversationException) {
        throw (ConversationException) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }

      throw new GenerationException("conversation failed: " + cause.getMessage(), cause);
    }
  }

  private static class ConversationThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable, "conversation-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
