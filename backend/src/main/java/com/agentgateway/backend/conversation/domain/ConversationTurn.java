package com.agentgateway.backend.conversation.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One message of a chat. Turns are never modified once stored; their position in the history is
 * the sequence marker.
 */
public record ConversationTurn(TurnRole role, String text, Instant timestamp) {

  public ConversationTurn {
    Objects.requireNonNull(role, "role must not be null");
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
  }

  public static ConversationTurn user(String text, Instant timestamp) {
    return new ConversationTurn(TurnRole.USER, text, timestamp);
  }

  public static ConversationTurn assistant(String text, Instant timestamp) {
    return new ConversationTurn(TurnRole.ASSISTANT, text, timestamp);
  }
}
