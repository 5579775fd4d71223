package com.agentgateway.backend.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
  CONFIG_NOT_FOUND(HttpStatus.NOT_FOUND, "Config not found"),
  STORAGE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable"),
  PROVIDER_ERROR(HttpStatus.BAD_GATEWAY, "Provider call failed"),
  VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Validation failed");

  private final HttpStatus httpStatus;
  private final String title;

  ErrorKind(HttpStatus httpStatus, String title) {
    this.httpStatus = httpStatus;
    this.title = title;
  }

  public HttpStatus httpStatus() {
    return httpStatus;
  }

  public String title() {
    return title;
  }
}
