package com.agentgateway.backend.agent.api;

import com.agentgateway.backend.agent.domain.AgentConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

public record AgentConfigView(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("config_id") String configId,
    @JsonProperty("bot_name") String botName,
    @JsonProperty("agent_config") Map<String, Object> agentConfig,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt) {

  public static AgentConfigView from(AgentConfig config) {
    return new AgentConfigView(
        config.clientId(),
        config.configId(),
        config.botName(),
        config.options(),
        config.createdAt(),
        config.updatedAt());
  }
}
