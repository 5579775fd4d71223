package com.agentgateway.backend.agent.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ConfigListResponse(
    @JsonProperty("client_id") String clientId, List<String> configs) {}
