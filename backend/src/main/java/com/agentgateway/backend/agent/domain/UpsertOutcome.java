package com.agentgateway.backend.agent.domain;

public enum UpsertOutcome {
  INSERTED("Configuration inserted successfully"),
  UPDATED("Configuration updated successfully");

  private final String message;

  UpsertOutcome(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }
}
