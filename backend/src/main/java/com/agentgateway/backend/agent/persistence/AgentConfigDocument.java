package com.agentgateway.backend.agent.persistence;

import com.agentgateway.backend.agent.domain.AgentConfig;
import java.time.Instant;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Document
public class AgentConfigDocument {

  static final String CLIENT_ID = "clientId";
  static final String CONFIG_ID = "configId";
  static final String BOT_NAME = "botName";
  static final String AGENT_CONFIG = "agentConfig";
  static final String CREATED_AT = "createdAt";
  static final String UPDATED_AT = "updatedAt";

  @Id private String id;

  @Field("client_id")
  private String clientId;

  @Field("config_id")
  private String configId;

  @Field("bot_name")
  private String botName;

  @Field("agent_config")
  private Map<String, Object> agentConfig;

  @Field("created_at")
  private Instant createdAt;

  @Field("updated_at")
  private Instant updatedAt;

  protected AgentConfigDocument() {}

  public String getId() {
    return id;
  }

  public String getClientId() {
    return clientId;
  }

  public String getConfigId() {
    return configId;
  }

  public String getBotName() {
    return botName;
  }

  public Map<String, Object> getAgentConfig() {
    return agentConfig;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  AgentConfig toDomain() {
    return new AgentConfig(clientId, configId, botName, agentConfig, createdAt, updatedAt);
  }
}
