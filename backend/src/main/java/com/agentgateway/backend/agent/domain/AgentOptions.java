package com.agentgateway.backend.agent.domain;

import java.util.Map;

/**
 * Typed view over the option keys of an {@link AgentConfig} that drive a provider call. Each
 * setting accepts the key used by stored configs ({@code model_name}, {@code prompt_preamble}) as
 * well as its short alias ({@code model}, {@code system_prompt}).
 */
public record AgentOptions(
    String modelName,
    String systemPrompt,
    double temperature,
    int maxTokens,
    String userInitialMessage,
    String botInitialMessage) {

  public static final String DEFAULT_MODEL = "gpt-4o-mini";
  public static final double DEFAULT_TEMPERATURE = 0.3;
  public static final int DEFAULT_MAX_TOKENS = 400;

  private static final double MAX_TEMPERATURE = 2.0;

  /**
   * @throws IllegalArgumentException when a recognised key holds a value of the wrong type or out
   *     of range
   */
  public static AgentOptions from(Map<String, Object> options) {
    Map<String, Object> source = options != null ? options : Map.of();

    String model = text(source, "model_name", "model");
    String systemPrompt = text(source, "prompt_preamble", "system_prompt");
    Double temperature = number(source, "temperature");
    Double maxTokens = number(source, "max_tokens");

    if (temperature != null && (temperature < 0 || temperature > MAX_TEMPERATURE)) {
      throw new IllegalArgumentException(
          "'temperature' must be between 0 and " + MAX_TEMPERATURE + ", got " + temperature);
    }
    if (maxTokens != null
        && (maxTokens < 1 || maxTokens > Integer.MAX_VALUE || maxTokens != Math.floor(maxTokens))) {
      throw new IllegalArgumentException("'max_tokens' must be a positive integer, got " + maxTokens);
    }

    return new AgentOptions(
        model != null ? model : DEFAULT_MODEL,
        systemPrompt,
        temperature != null ? temperature : DEFAULT_TEMPERATURE,
        maxTokens != null ? maxTokens.intValue() : DEFAULT_MAX_TOKENS,
        text(source, "user_initial_message"),
        text(source, "bot_initial_message"));
  }

  public boolean hasSystemPrompt() {
    return systemPrompt != null;
  }

  private static String text(Map<String, Object> source, String... keys) {
    for (String key : keys) {
      Object value = source.get(key);
      if (value == null) {
        continue;
      }
      if (!(value instanceof String stringValue)) {
        throw new IllegalArgumentException("'" + key + "' must be a string");
      }
      if (!stringValue.isBlank()) {
        return stringValue;
      }
    }
    return null;
  }

  private static Double number(Map<String, Object> source, String key) {
    Object value = source.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number numberValue) {
      return numberValue.doubleValue();
    }
    if (value instanceof String stringValue && !stringValue.isBlank()) {
      try {
        return Double.parseDouble(stringValue.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("'" + key + "' must be a number, got '" + value + "'", ex);
      }
    }
    throw new IllegalArgumentException("'" + key + "' must be a number");
  }
}
