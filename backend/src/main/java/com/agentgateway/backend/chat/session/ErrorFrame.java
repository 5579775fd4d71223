package com.agentgateway.backend.chat.session;

import com.agentgateway.backend.common.exception.GatewayException;

/** Payload of the text frame sent when a connection attempt or a turn fails. */
public record ErrorFrame(String error, String message) {

  public static ErrorFrame from(GatewayException ex) {
    return new ErrorFrame(ex.getKind().name(), ex.getMessage());
  }
}
