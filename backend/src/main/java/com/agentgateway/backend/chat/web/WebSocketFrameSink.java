package com.agentgateway.backend.chat.web;

import com.agentgateway.backend.chat.session.FrameSink;
import java.io.IOException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class WebSocketFrameSink implements FrameSink {

  private final WebSocketSession session;

  WebSocketFrameSink(WebSocketSession session) {
    this.session = session;
  }

  @Override
  public void sendText(String payload) throws IOException {
    if (!session.isOpen()) {
      throw new IOException("WebSocket session " + session.getId() + " is closed");
    }
    session.sendMessage(new TextMessage(payload));
  }

  @Override
  public void close(String reason) throws IOException {
    if (session.isOpen()) {
      session.close(CloseStatus.POLICY_VIOLATION.withReason(reason));
    }
  }
}
