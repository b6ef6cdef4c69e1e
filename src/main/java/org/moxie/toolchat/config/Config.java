package org.moxie.toolchat.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.moxie.toolchat.llm.AiConfig;

import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class Config {

  @Inject
  @ConfigProperty(name = "mcp.enabled", defaultValue = "true")
  private boolean mcpEnabled;

  @Inject
  @ConfigProperty(name = "mcp.servers.config")
  private Optional<String> mcpServersConfig;

  @Inject
  @ConfigProperty(name = "proxy.url")
  private Optional<String> proxyUrl;

  @Inject
  @ConfigProperty(name = "ai.provider", defaultValue = "openai")
  private String aiProvider;

  @Inject
  @ConfigProperty(name = "ai.base_url", defaultValue = "https://api.openai.com/v1")
  private String aiBaseUrl;

  @Inject
  @ConfigProperty(name = "ai.api_key")
  private Optional<String> aiApiKey;

  @Inject
  @ConfigProperty(name = "ai.model", defaultValue = "gpt-4o-mini")
  private String aiModel;

  @Inject
  @ConfigProperty(name = "ai.default_prompt", defaultValue = "You are a helpful assistant.")
  private String aiDefaultPrompt;

  @Inject
  @ConfigProperty(name = "ai.max_iterations", defaultValue = "5")
  private int maxIterations;

  @Inject
  @ConfigProperty(name = "ai.run_timeout_seconds", defaultValue = "120")
  private int runTimeoutSeconds;

  @Inject
  @ConfigProperty(name = "ai.platform_prompts")
  private Optional<String> platformPrompts;

  @Inject
  @ConfigProperty(name = "ai.personas")
  private Optional<String> personas;

  @Inject
  @ConfigProperty(name = "ai.news_prompt", defaultValue = "You are a professional news anchor. Fetch the latest news and give a concise, clear summary.")
  private String newsPrompt;

  @Inject
  @ConfigProperty(name = "ai.search_prompt", defaultValue = "You are a research assistant. Use the available search tools before answering and cite your sources.")
  private String searchPrompt;

  @Inject
  @ConfigProperty(name = "access.allowed_users")
  private Optional<String> allowedUsers;

  @Inject
  @ConfigProperty(name = "access.allowed_users.legacy")
  private Optional<String> legacyAllowedUsers;

  @Inject
  @ConfigProperty(name = "push.enabled", defaultValue = "false")
  private boolean pushEnabled;

  @Inject
  @ConfigProperty(name = "push.time", defaultValue = "08:00")
  private String pushTime;

  @Inject
  @ConfigProperty(name = "push.targets")
  private Optional<String> pushTargets;

  @Inject
  @ConfigProperty(name = "push.prompt", defaultValue = "Search for today's top news and summarize the key events.")
  private String pushPrompt;

  @Inject
  @ConfigProperty(name = "push.system_prompt", defaultValue = "You are a news reporter.")
  private String pushSystemPrompt;

  @Inject
  @ConfigProperty(name = "delivery.webhooks")
  private Optional<String> deliveryWebhooks;

  @Inject
  @ConfigProperty(name = "storage.path", defaultValue = "storage.json")
  private String storagePath;

  public boolean isMcpEnabled() {
    return mcpEnabled;
  }

  public String getMcpServersConfig() {
    return mcpServersConfig.orElse(null);
  }

  public String getProxyUrl() {
    return proxyUrl.orElse(null);
  }

  public String getAiProvider() {
    return aiProvider;
  }

  public String getAiBaseUrl() {
    return aiBaseUrl;
  }

  public String getAiApiKey() {
    return aiApiKey.orElse("");
  }

  public String getAiModel() {
    return aiModel;
  }

  public String getAiDefaultPrompt() {
    return aiDefaultPrompt;
  }

  /**
   * The model endpoint used by anyone without a per-user override.
   */
  public AiConfig getDefaultAiConfig() {
    return new AiConfig(aiProvider, aiBaseUrl, getAiApiKey(), aiModel, aiDefaultPrompt);
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public int getRunTimeoutSeconds() {
    return runTimeoutSeconds;
  }

  public String getPlatformPrompts() {
    return platformPrompts.orElse(null);
  }

  public String getPersonas() {
    return personas.orElse(null);
  }

  public String getNewsPrompt() {
    return newsPrompt;
  }

  public String getSearchPrompt() {
    return searchPrompt;
  }

  public String getAllowedUsers() {
    return allowedUsers.orElse(null);
  }

  public List<String> getLegacyAllowedUsers() {
    return splitList(legacyAllowedUsers.orElse(null));
  }

  public boolean isPushEnabled() {
    return pushEnabled;
  }

  public String getPushTime() {
    return pushTime;
  }

  public List<String> getPushTargets() {
    return splitList(pushTargets.orElse(null));
  }

  public String getPushPrompt() {
    return pushPrompt;
  }

  public String getPushSystemPrompt() {
    return pushSystemPrompt;
  }

  public String getDeliveryWebhooks() {
    return deliveryWebhooks.orElse(null);
  }

  public String getStoragePath() {
    return storagePath;
  }

  private static List<String> splitList(String value) {
    if (value == null || value.isBlank()) {
      return new LinkedList<>();
    }

    return Arrays.stream(value.split(","))
                 .map(String::trim)
                 .filter(s -> !s.isEmpty())
                 .toList();
  }
}
