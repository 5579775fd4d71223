package com.agentgateway.backend.conversation.persistence;

import com.agentgateway.backend.conversation.domain.ConversationTurn;
import com.agentgateway.backend.conversation.domain.TurnRole;
import java.time.Instant;

public class TurnDocument {

  private String sender;
  private String text;
  private Instant timestamp;

  protected TurnDocument() {}

  TurnDocument(String sender, String text, Instant timestamp) {
    this.sender = sender;
    this.text = text;
    this.timestamp = timestamp;
  }

  static TurnDocument from(ConversationTurn turn) {
    return new TurnDocument(turn.role().storedValue(), turn.text(), turn.timestamp());
  }

  public String getSender() {
    return sender;
  }

  public String getText() {
    return text;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  ConversationTurn toDomain() {
    return new ConversationTurn(TurnRole.fromStoredValue(sender), text, timestamp);
  }
}
