package com.agentgateway.backend.chat.session;

public enum SessionState {
  CONNECTED,
  AWAITING_MESSAGE,
  PROCESSING,
  CLOSED
}
