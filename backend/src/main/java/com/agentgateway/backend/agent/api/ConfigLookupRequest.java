package com.agentgateway.backend.agent.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ConfigLookupRequest(
    @JsonProperty("client_id") @NotBlank String clientId,
    @JsonProperty("config_id") @NotBlank String configId) {}
