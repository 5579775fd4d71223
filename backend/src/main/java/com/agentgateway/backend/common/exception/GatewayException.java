package com.agentgateway.backend.common.exception;

/**
 * Base type for failures that are reported to the caller with an {@link ErrorKind}: as a
 * {@code ProblemDetail} over HTTP or as an error frame over the chat socket.
 */
public abstract class GatewayException extends RuntimeException {

  private final ErrorKind kind;

  protected GatewayException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected GatewayException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}
