package com.agentgateway.backend.chat.session;

import com.agentgateway.backend.agent.persistence.AgentConfigStore;
import com.agentgateway.backend.chat.agent.ChatAgent;
import com.agentgateway.backend.conversation.domain.ConversationKey;
import com.agentgateway.backend.conversation.persistence.ConversationStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.springframework.stereotype.Component;

@Component
public class GatewaySessionFactory {

  private final AgentConfigStore configStore;
  private final ConversationStore conversationStore;
  private final ChatAgent chatAgent;
  private final ObjectMapper objectMapper;
  private final GatewayMetrics metrics;
  private final Clock clock;

  public GatewaySessionFactory(
      AgentConfigStore configStore,
      ConversationStore conversationStore,
      ChatAgent chatAgent,
      ObjectMapper objectMapper,
      GatewayMetrics metrics,
      Clock clock) {
    this.configStore = configStore;
    this.conversationStore = conversationStore;
    this.chatAgent = chatAgent;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
  }

  public GatewaySession create(ConversationKey key, FrameSink sink) {
    return new GatewaySession(
        key, sink, configStore, conversationStore, chatAgent, objectMapper, metrics, clock);
  }
}
