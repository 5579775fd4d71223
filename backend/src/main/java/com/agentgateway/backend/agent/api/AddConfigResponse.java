package com.agentgateway.backend.agent.api;

import com.agentgateway.backend.agent.domain.UpsertOutcome;

public record AddConfigResponse(String status, String message) {

  public static AddConfigResponse of(UpsertOutcome outcome) {
    return new AddConfigResponse("ok", outcome.message());
  }
}
