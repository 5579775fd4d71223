package com.agentgateway.backend.agent.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AgentOptionsTest {

  @Test
  void appliesDefaultsForEmptyMapping() {
    AgentOptions options = AgentOptions.from(Map.of());

    assertThat(options.modelName()).isEqualTo(AgentOptions.DEFAULT_MODEL);
    assertThat(options.temperature()).isEqualTo(AgentOptions.DEFAULT_TEMPERATURE);
    assertThat(options.maxTokens()).isEqualTo(AgentOptions.DEFAULT_MAX_TOKENS);
    assertThat(options.hasSystemPrompt()).isFalse();
    assertThat(options.userInitialMessage()).isNull();
    assertThat(options.botInitialMessage()).isNull();
  }

  @Test
  void readsStoredKeysBeforeAliases() {
    AgentOptions options =
        AgentOptions.from(
            Map.of(
                "model_name", "gpt-4o",
                "model", "ignored",
                "prompt_preamble", "You are a pirate.",
                "temperature", 0.9,
                "max_tokens", 128));

    assertThat(options.modelName()).isEqualTo("gpt-4o");
    assertThat(options.systemPrompt()).isEqualTo("You are a pirate.");
    assertThat(options.temperature()).isEqualTo(0.9);
    assertThat(options.maxTokens()).isEqualTo(128);
  }

  @Test
  void acceptsAliasesAndNumericStrings() {
    AgentOptions options =
        AgentOptions.from(
            Map.of("model", "x", "system_prompt", "p", "temperature", "1.5", "max_tokens", "64"));

    assertThat(options.modelName()).isEqualTo("x");
    assertThat(options.systemPrompt()).isEqualTo("p");
    assertThat(options.temperature()).isEqualTo(1.5);
    assertThat(options.maxTokens()).isEqualTo(64);
  }

  @Test
  void ignoresUnknownKeysAndNullValues() {
    Map<String, Object> raw = new HashMap<>();
    raw.put("custom_flag", true);
    raw.put("model_name", null);

    AgentOptions options = AgentOptions.from(raw);

    assertThat(options.modelName()).isEqualTo(AgentOptions.DEFAULT_MODEL);
  }

  @Test
  void rejectsOutOfRangeTemperature() {
    assertThatThrownBy(() -> AgentOptions.from(Map.of("temperature", 3)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("temperature");
  }

  @Test
  void rejectsFractionalMaxTokens() {
    assertThatThrownBy(() -> AgentOptions.from(Map.of("max_tokens", 12.5)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("max_tokens");
  }

  @Test
  void rejectsMaxTokensBeyondIntegerRange() {
    assertThatThrownBy(() -> AgentOptions.from(Map.of("max_tokens", 1e12)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("max_tokens");
  }

  @Test
  void rejectsNonStringModel() {
    assertThatThrownBy(() -> AgentOptions.from(Map.of("model_name", 42)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("model_name");
  }
}
