package com.agentgateway.backend.common.exception;

public class StorageException extends GatewayException {

  public StorageException(String message, Throwable cause) {
    super(ErrorKind.STORAGE_ERROR, message, cause);
  }
}
