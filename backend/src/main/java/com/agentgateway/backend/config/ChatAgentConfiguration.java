package com.agentgateway.backend.config;

import com.agentgateway.backend.agent.domain.AgentOptions;
import com.agentgateway.backend.chat.agent.AgentPromptBuilder;
import com.agentgateway.backend.chat.agent.ChatAgent;
import com.agentgateway.backend.chat.agent.OpenAiChatAgent;
import com.agentgateway.backend.chat.logging.ChatLoggingProperties;
import com.agentgateway.backend.chat.logging.ChatLoggingSupport;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({GatewayProperties.class, ChatLoggingProperties.class})
public class ChatAgentConfiguration {

  @Bean
  public ChatLoggingSupport chatLoggingSupport(ChatLoggingProperties properties) {
    return new ChatLoggingSupport(properties);
  }

  @Bean
  public OpenAiApi openAiApi(GatewayProperties properties) {
    GatewayProperties.Provider provider = properties.getProvider();

    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(provider.getConnectTimeout());
    requestFactory.setReadTimeout(provider.getReadTimeout());

    OpenAiApi.Builder builder =
        OpenAiApi.builder()
            .apiKey(provider.getApiKey())
            .restClientBuilder(RestClient.builder().requestFactory(requestFactory));
    if (StringUtils.hasText(provider.getBaseUrl())) {
      builder.baseUrl(provider.getBaseUrl());
    }
    if (StringUtils.hasText(provider.getCompletionsPath())) {
      builder.completionsPath(provider.getCompletionsPath());
    }
    return builder.build();
  }

  /**
   * The model is built with a single-attempt retry template: provider failures surface to the
   * session as they happen.
   */
  @Bean
  public ChatModel agentChatModel(OpenAiApi openAiApi, ChatLoggingSupport chatLoggingSupport) {
    OpenAiChatModel chatModel =
        OpenAiChatModel.builder()
            .openAiApi(openAiApi)
            .defaultOptions(OpenAiChatOptions.builder().model(AgentOptions.DEFAULT_MODEL).build())
            .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
            .build();
    return chatLoggingSupport.decorateModel(chatModel);
  }

  @Bean
  public ChatAgent chatAgent(ChatModel agentChatModel) {
    return new OpenAiChatAgent(agentChatModel, new AgentPromptBuilder());
  }
}
