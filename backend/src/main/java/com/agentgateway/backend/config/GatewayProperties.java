package com.agentgateway.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.util.unit.DataSize;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Process-wide settings resolved once at startup from the environment (see
 * {@code application.yml}). Binding fails, and the application refuses to start, when any of the
 * required values is absent or blank.
 */
@ConfigurationProperties(prefix = "app.gateway")
@Validated
public class GatewayProperties {

  @Valid @NotNull private Provider provider = new Provider();

  @Valid @NotNull private Store store = new Store();

  @Valid @NotNull private Chat chat = new Chat();

  public Provider getProvider() {
    return provider;
  }

  public void setProvider(Provider provider) {
    this.provider = provider;
  }

  public Store getStore() {
    return store;
  }

  public void setStore(Store store) {
    this.store = store;
  }

  public Chat getChat() {
    return chat;
  }

  public void setChat(Chat chat) {
    this.chat = chat;
  }

  public static class Provider {

    /**
     * API key of the OpenAI account the agents are billed to ({@code OPENAI_API_KEY}).
     */
    @NotBlank(message = "OPENAI_API_KEY must be set")
    private String apiKey;

    private String baseUrl = "https://api.openai.com";

    private String completionsPath;

    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Upper bound for a single provider round trip; a turn waiting longer fails with a provider
     * error instead of holding the connection indefinitely.
     */
    private Duration readTimeout = Duration.ofSeconds(60);

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getCompletionsPath() {
      return completionsPath;
    }

    public void setCompletionsPath(String completionsPath) {
      this.completionsPath = completionsPath;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
      return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
    }
  }

  public static class Store {

    @NotBlank(message = "MONGODB_URI must be set")
    private String uri;

    @NotBlank(message = "MONGODB_DATABASE must be set")
    private String database;

    @NotBlank(message = "CONFIG_COLLECTION must be set")
    private String configCollection;

    @NotBlank(message = "CONVERSATION_COLLECTION must be set")
    private String conversationCollection;

    public String getUri() {
      return uri;
    }

    public void setUri(String uri) {
      this.uri = uri;
    }

    public String getDatabase() {
      return database;
    }

    public void setDatabase(String database) {
      this.database = database;
    }

    public String getConfigCollection() {
      return configCollection;
    }

    public void setConfigCollection(String configCollection) {
      this.configCollection = configCollection;
    }

    public String getConversationCollection() {
      return conversationCollection;
    }

    public void setConversationCollection(String conversationCollection) {
      this.conversationCollection = conversationCollection;
    }
  }

  public static class Chat {

    /** Largest inbound chat frame the socket buffers before the container closes it. */
    @NotNull private DataSize maxMessageSize = DataSize.ofMegabytes(1);

    public DataSize getMaxMessageSize() {
      return maxMessageSize;
    }

    public void setMaxMessageSize(DataSize maxMessageSize) {
      this.maxMessageSize = maxMessageSize;
    }
  }
}
