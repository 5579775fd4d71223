package com.agentgateway.backend.chat.session;

import java.io.IOException;

/** Outbound side of a chat connection. */
public interface FrameSink {

  void sendText(String payload) throws IOException;

  void close(String reason) throws IOException;
}
