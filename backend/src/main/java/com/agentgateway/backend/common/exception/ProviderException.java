package com.agentgateway.backend.common.exception;

public class ProviderException extends GatewayException {

  public ProviderException(String message) {
    super(ErrorKind.PROVIDER_ERROR, message);
  }

  public ProviderException(String message, Throwable cause) {
    super(ErrorKind.PROVIDER_ERROR, message, cause);
  }
}
