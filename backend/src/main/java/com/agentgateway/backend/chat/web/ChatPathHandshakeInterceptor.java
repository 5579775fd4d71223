package com.agentgateway.backend.chat.web;

import com.agentgateway.backend.conversation.domain.ConversationKey;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriUtils;

/**
 * Resolves {@code .../chat/{client_id}/{config_id}/{chat_id}} into a {@link ConversationKey} before
 * the upgrade. Requests whose path does not carry three non-blank identifiers are refused with
 * {@code 400}.
 */
@Slf4j
public class ChatPathHandshakeInterceptor implements HandshakeInterceptor {

  public static final String CONVERSATION_KEY_ATTRIBUTE = "gateway.conversationKey";

  private static final String CHAT_SEGMENT = "chat";

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    ConversationKey key = resolveKey(request.getURI().getRawPath());
    if (key == null) {
      log.debug("Refusing chat handshake for path {}", request.getURI().getRawPath());
      response.setStatusCode(HttpStatus.BAD_REQUEST);
      return false;
    }
    attributes.put(CONVERSATION_KEY_ATTRIBUTE, key);
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {}

  static ConversationKey resolveKey(String rawPath) {
    if (rawPath == null) {
      return null;
    }
    String[] segments =
        Arrays.stream(rawPath.split("/")).filter(s -> !s.isEmpty()).toArray(String[]::new);
    if (segments.length < 4 || !CHAT_SEGMENT.equals(segments[segments.length - 4])) {
      return null;
    }
    String clientId = decode(segments[segments.length - 3]);
    String configId = decode(segments[segments.length - 2]);
    String chatId = decode(segments[segments.length - 1]);
    if (!StringUtils.hasText(clientId)
        || !StringUtils.hasText(configId)
        || !StringUtils.hasText(chatId)) {
      return null;
    }
    return new ConversationKey(clientId, configId, chatId);
  }

  private static String decode(String segment) {
    try {
      return UriUtils.decode(segment, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      log.debug("Malformed path segment '{}': {}", segment, ex.getMessage());
      return null;
    }
  }
}
