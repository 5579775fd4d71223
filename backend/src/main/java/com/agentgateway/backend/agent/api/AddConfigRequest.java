package com.agentgateway.backend.agent.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

public record AddConfigRequest(
    @JsonProperty("client_id") @NotBlank String clientId,
    @JsonProperty("config_id") @NotBlank String configId,
    @JsonProperty("config") @JsonAlias("agent_config") @NotNull Map<String, Object> config,
    @JsonProperty("bot_name") String botName) {}
