package com.agentgateway.backend.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final String ERROR_PROPERTY = "error";

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    if (ex instanceof ErrorResponse errorResponse
        && errorResponse.getStatusCode().is4xxClientError()) {
      return ResponseEntity.status(errorResponse.getStatusCode()).body(errorResponse.getBody());
    }
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(GatewayException.class)
  public ResponseEntity<ProblemDetail> handleGatewayException(GatewayException ex) {
    ErrorKind kind = ex.getKind();
    if (kind.httpStatus().is5xxServerError()) {
      log.warn("Request failed with {}: {}", kind, ex.getMessage(), ex);
    } else {
      log.debug("Request rejected with {}: {}", kind, ex.getMessage());
    }
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(kind.httpStatus(), ex.getMessage());
    problem.setTitle(kind.title());
    problem.setProperty(ERROR_PROPERTY, kind.name());
    return ResponseEntity.status(kind.httpStatus()).body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    return badRequest(resolveValidationMessage(ex));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex) {
    return badRequest("Request body is missing or is not valid JSON");
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ProblemDetail> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return badRequest("Missing required parameter '" + ex.getParameterName() + "'");
  }

  @ExceptionHandler({
    HttpRequestMethodNotSupportedException.class,
    HttpMediaTypeNotSupportedException.class,
    HttpMediaTypeNotAcceptableException.class,
    NoResourceFoundException.class
  })
  public ResponseEntity<ProblemDetail> handleRoutingErrors(Exception ex) {
    ErrorResponse errorResponse = (ErrorResponse) ex;
    return ResponseEntity.status(errorResponse.getStatusCode()).body(errorResponse.getBody());
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private ResponseEntity<ProblemDetail> badRequest(String detail) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(ErrorKind.VALIDATION_ERROR.title());
    problem.setDetail(detail);
    problem.setProperty(ERROR_PROPERTY, ErrorKind.VALIDATION_ERROR.name());
    return ResponseEntity.badRequest().body(problem);
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof BindException bindException) {
      return bindException.getBindingResult().getFieldErrors().stream()
          .findFirst()
          .map(
              error ->
                  error.getDefaultMessage() != null
                      ? error.getField() + ": " + error.getDefaultMessage()
                      : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    return "Invalid request payload";
  }
}
