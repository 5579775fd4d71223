package com.agentgateway.backend.chat.agent;

import com.agentgateway.backend.agent.domain.AgentConfig;
import com.agentgateway.backend.conversation.domain.ConversationTurn;
import java.util.List;

/** A configured LLM call: one fresh provider round trip per invocation. */
public interface ChatAgent {

  /**
   * @throws com.agentgateway.backend.common.exception.ProviderException when the provider fails,
   *     times out or returns no text
   */
  String generateReply(AgentConfig config, List<ConversationTurn> history, String userMessage);
}
