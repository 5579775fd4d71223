package com.agentgateway.backend.conversation.domain;

import java.util.Objects;

/** Identifies one chat scoped to a {@code (client, config)} pair. */
public record ConversationKey(String clientId, String configId, String chatId) {

  public ConversationKey {
    Objects.requireNonNull(clientId, "clientId must not be null");
    Objects.requireNonNull(configId, "configId must not be null");
    Objects.requireNonNull(chatId, "chatId must not be null");
  }

  @Override
  public String toString() {
    return clientId + "/" + configId + "/" + chatId;
  }
}
