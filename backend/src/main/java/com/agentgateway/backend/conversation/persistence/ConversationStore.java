package com.agentgateway.backend.conversation.persistence;

import com.agentgateway.backend.conversation.domain.ConversationKey;
import com.agentgateway.backend.conversation.domain.ConversationTurn;
import com.agentgateway.backend.conversation.domain.TurnRole;
import java.time.Instant;
import java.util.List;

/**
 * Append-only chat history. Implementations report an unreachable or failing store with {@link
 * com.agentgateway.backend.common.exception.StorageException}.
 */
public interface ConversationStore {

  /** Appends all turns in one write, in list order. Either every turn is stored or none is. */
  void appendTurns(ConversationKey key, List<ConversationTurn> turns);

  default void appendTurn(ConversationKey key, TurnRole role, String text) {
    appendTurns(key, List.of(new ConversationTurn(role, text, Instant.now())));
  }

  /** Turns of the chat in the order they were appended; empty for an unknown chat. */
  List<ConversationTurn> getHistory(ConversationKey key);
}
