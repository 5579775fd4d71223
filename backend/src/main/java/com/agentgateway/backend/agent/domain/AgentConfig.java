package com.agentgateway.backend.agent.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored parameter set of one agent variant for one client. {@code options} is kept opaque; the
 * chat agent reads the keys it understands through {@link AgentOptions}.
 */
public record AgentConfig(
    String clientId,
    String configId,
    String botName,
    Map<String, Object> options,
    Instant createdAt,
    Instant updatedAt) {

  public static final String DEFAULT_BOT_NAME = "Untitled Bot";

  public AgentConfig {
    options =
        options != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(options))
            : Map.of();
    botName = botName != null && !botName.isBlank() ? botName : DEFAULT_BOT_NAME;
  }

  public AgentOptions agentOptions() {
    return AgentOptions.from(options);
  }
}
