package com.agentgateway.backend.common.exception;

public class RequestValidationException extends GatewayException {

  public RequestValidationException(String message) {
    super(ErrorKind.VALIDATION_ERROR, message);
  }

  public RequestValidationException(String message, Throwable cause) {
    super(ErrorKind.VALIDATION_ERROR, message, cause);
  }
}
