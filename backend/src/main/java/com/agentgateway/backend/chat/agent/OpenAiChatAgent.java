package com.agentgateway.backend.chat.agent;

import com.agentgateway.backend.agent.domain.AgentConfig;
import com.agentgateway.backend.agent.domain.AgentOptions;
import com.agentgateway.backend.common.exception.ProviderException;
import com.agentgateway.backend.conversation.domain.ConversationTurn;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientResponseException;

@Slf4j
public class OpenAiChatAgent implements ChatAgent {

  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private final ChatModel chatModel;
  private final AgentPromptBuilder promptBuilder;

  public OpenAiChatAgent(ChatModel chatModel, AgentPromptBuilder promptBuilder) {
    this.chatModel = chatModel;
    this.promptBuilder = promptBuilder;
  }

  @Override
  public String generateReply(
      AgentConfig config, List<ConversationTurn> history, String userMessage) {
    AgentOptions options = resolveOptions(config);
    Prompt prompt =
        new Prompt(promptBuilder.build(options, history, userMessage), buildOptions(options));

    ChatResponse response;
    try {
      response = chatModel.call(prompt);
    } catch (RuntimeException ex) {
      logError(config, ex);
      throw new ProviderException(buildErrorMessage(ex), ex);
    }

    String content = extractContent(response);
    if (!StringUtils.hasText(content)) {
      throw new ProviderException("Model returned an empty response");
    }
    if (log.isDebugEnabled()) {
      log.debug(
          "Reply for {}/{} from model {}: {} chars",
          config.clientId(),
          config.configId(),
          options.modelName(),
          content.length());
    }
    return content;
  }

  private AgentOptions resolveOptions(AgentConfig config) {
    try {
      return config.agentOptions();
    } catch (IllegalArgumentException ex) {
      throw new ProviderException(
          "Stored options of config '" + config.configId() + "' are invalid: " + ex.getMessage(),
          ex);
    }
  }

  private OpenAiChatOptions buildOptions(AgentOptions options) {
    return OpenAiChatOptions.builder()
        .model(options.modelName())
        .temperature(options.temperature())
        .maxTokens(options.maxTokens())
        .build();
  }

  private String extractContent(ChatResponse response) {
    if (response == null) {
      return null;
    }
    Generation generation = response.getResult();
    if (generation == null || generation.getOutput() == null) {
      return null;
    }
    return generation.getOutput().getText();
  }

  private void logError(AgentConfig config, RuntimeException error) {
    if (error instanceof RestClientResponseException responseError) {
      log.error(
          "LLM call failed for {}/{} with status {} and body: {}",
          config.clientId(),
          config.configId(),
          responseError.getStatusCode(),
          sanitize(responseError.getResponseBodyAsString()),
          responseError);
    } else {
      log.error("LLM call failed for {}/{}", config.clientId(), config.configId(), error);
    }
  }

  private String buildErrorMessage(RuntimeException error) {
    if (error instanceof RestClientResponseException responseError) {
      String status = responseError.getStatusCode().value() + " " + responseError.getStatusText();
      String body = sanitize(responseError.getResponseBodyAsString());
      if (StringUtils.hasText(body)) {
        return "Failed to obtain response from model: " + status + " - " + body;
      }
      return "Failed to obtain response from model: " + status;
    }

    String message = sanitize(error.getMessage());
    if (!StringUtils.hasText(message)) {
      message = error.getClass().getSimpleName();
    }
    return "Failed to obtain response from model: " + message;
  }

  private String sanitize(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    String normalized = value.replaceAll("\\s+", " ").trim();
    if (normalized.length() <= MAX_ERROR_BODY_LENGTH) {
      return normalized;
    }
    return normalized.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
  }
}
