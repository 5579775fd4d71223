package com.agentgateway.backend.config;

import com.agentgateway.backend.chat.web.ChatPathHandshakeInterceptor;
import com.agentgateway.backend.chat.web.ChatWebSocketHandler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@EnableConfigurationProperties(GatewayProperties.class)
public class WebSocketConfiguration implements WebSocketConfigurer {

  static final String CHAT_PATH = "/chat/*/*/*";

  private final ChatWebSocketHandler chatWebSocketHandler;

  public WebSocketConfiguration(ChatWebSocketHandler chatWebSocketHandler) {
    this.chatWebSocketHandler = chatWebSocketHandler;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(chatWebSocketHandler, CHAT_PATH)
        .addInterceptors(new ChatPathHandshakeInterceptor())
        .setAllowedOrigins("*");
  }

  /** Raises the container's 8 KB default so a whole chat message fits in one text frame. */
  @Bean
  public ServletServerContainerFactoryBean webSocketContainer(GatewayProperties properties) {
    int maxMessageSize = Math.toIntExact(properties.getChat().getMaxMessageSize().toBytes());
    ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
    container.setMaxTextMessageBufferSize(maxMessageSize);
    container.setMaxBinaryMessageBufferSize(maxMessageSize);
    return container;
  }
}
