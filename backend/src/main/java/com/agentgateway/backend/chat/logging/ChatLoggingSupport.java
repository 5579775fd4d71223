package com.agentgateway.backend.chat.logging;

import java.util.Objects;
import org.springframework.ai.chat.model.ChatModel;

/** Applies the optional prompt/completion logging decoration to chat models. */
public class ChatLoggingSupport {

  private final ChatLoggingProperties properties;

  public ChatLoggingSupport(ChatLoggingProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
  }

  public ChatModel decorateModel(ChatModel delegate) {
    if (delegate == null || delegate instanceof LoggingChatModel || !properties.isPromptEnabled()) {
      return delegate;
    }
    return new LoggingChatModel(delegate, properties.isLogCompletion());
  }
}
