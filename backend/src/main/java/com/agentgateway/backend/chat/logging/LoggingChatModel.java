package com.agentgateway.backend.chat.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

/**
 * Decorator for {@link ChatModel} that logs every transcript sent to the provider and,
 * optionally, the completion that comes back.
 */
public class LoggingChatModel implements ChatModel {

  private static final Logger log = LoggerFactory.getLogger(LoggingChatModel.class);

  private final ChatModel delegate;
  private final boolean logCompletion;

  public LoggingChatModel(ChatModel delegate, boolean logCompletion) {
    this.delegate = delegate;
    this.logCompletion = logCompletion;
  }

  @Override
  public ChatResponse call(Prompt prompt) {
    if (log.isDebugEnabled()) {
      StringBuilder transcript = new StringBuilder();
      for (Message message : prompt.getInstructions()) {
        transcript
            .append('\n')
            .append(message.getMessageType().getValue())
            .append(": ")
            .append(message.getText());
      }
      log.debug("===== PROMPT >>> ({} messages) ====={}", prompt.getInstructions().size(), transcript);
    }
    ChatResponse response = delegate.call(prompt);
    if (logCompletion && log.isDebugEnabled()) {
      Generation generation = response != null ? response.getResult() : null;
      if (generation != null && generation.getOutput() != null) {
        log.debug("===== COMPLETION <<< =====\n{}", generation.getOutput().getText());
      }
    }
    return response;
  }

  @Override
  public Flux<ChatResponse> stream(Prompt prompt) {
    return delegate.stream(prompt);
  }

  @Override
  public ChatOptions getDefaultOptions() {
    return delegate.getDefaultOptions();
  }
}
