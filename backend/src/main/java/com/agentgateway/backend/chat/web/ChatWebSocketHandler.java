package com.agentgateway.backend.chat.web;

import com.agentgateway.backend.chat.session.GatewaySession;
import com.agentgateway.backend.chat.session.GatewaySessionFactory;
import com.agentgateway.backend.conversation.domain.ConversationKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Binds every WebSocket connection to a {@link GatewaySession}. The container delivers the frames
 * of one connection sequentially, so a connection never has two turns in flight.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

  static final String GATEWAY_SESSION_ATTRIBUTE = "gateway.session";

  private final GatewaySessionFactory sessionFactory;

  public ChatWebSocketHandler(GatewaySessionFactory sessionFactory) {
    this.sessionFactory = sessionFactory;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) throws Exception {
    Object key = session.getAttributes().get(ChatPathHandshakeInterceptor.CONVERSATION_KEY_ATTRIBUTE);
    if (!(key instanceof ConversationKey conversationKey)) {
      log.warn("WebSocket session {} has no conversation key, closing", session.getId());
      session.close(CloseStatus.BAD_DATA.withReason("Missing chat path"));
      return;
    }
    GatewaySession gatewaySession =
        sessionFactory.create(conversationKey, new WebSocketFrameSink(session));
    session.getAttributes().put(GATEWAY_SESSION_ATTRIBUTE, gatewaySession);
    gatewaySession.open();
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    GatewaySession gatewaySession = gatewaySession(session);
    if (gatewaySession == null) {
      log.debug("Ignoring frame on unbound WebSocket session {}", session.getId());
      return;
    }
    gatewaySession.onMessage(message.getPayload());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn("Transport error on WebSocket session {}: {}", session.getId(), exception.getMessage());
    GatewaySession gatewaySession = gatewaySession(session);
    if (gatewaySession != null) {
      gatewaySession.onClose();
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    GatewaySession gatewaySession = gatewaySession(session);
    if (gatewaySession != null) {
      gatewaySession.onClose();
    }
    log.debug("WebSocket session {} closed with {}", session.getId(), status);
  }

  private GatewaySession gatewaySession(WebSocketSession session) {
    Object value = session.getAttributes().get(GATEWAY_SESSION_ATTRIBUTE);
    return value instanceof GatewaySession gatewaySession ? gatewaySession : null;
  }
}
