package com.agentgateway.backend.conversation.domain;

import java.util.Arrays;

public enum TurnRole {
  USER("user"),
  ASSISTANT("bot");

  private final String storedValue;

  TurnRole(String storedValue) {
    this.storedValue = storedValue;
  }

  /** Value of the {@code sender} field in persisted messages. */
  public String storedValue() {
    return storedValue;
  }

  public static TurnRole fromStoredValue(String value) {
    return Arrays.stream(values())
        .filter(role -> role.storedValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown message sender: " + value));
  }
}
