package com.promptsmith.optimizer.exception;

import org.springframework.http.HttpStatus;

/** Failure categories carried by optimization results and mapped to HTTP statuses. */
public enum ErrorKind {
  CONFIG(HttpStatus.BAD_REQUEST),
  DATA_GENERATION(HttpStatus.INTERNAL_SERVER_ERROR),
  SESSION_NOT_FOUND(HttpStatus.NOT_FOUND),
  NO_FEEDBACK_FOUND(HttpStatus.BAD_REQUEST),
  LANGUAGE_MODEL_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
  LANGUAGE_MODEL_PROVIDER(HttpStatus.BAD_GATEWAY),
  TRAINER(HttpStatus.INTERNAL_SERVER_ERROR),
  TRAINER_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
  CANCELLED(HttpStatus.CONFLICT),
  INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

  private final HttpStatus httpStatus;

  ErrorKind(HttpStatus httpStatus) {
    this.httpStatus = httpStatus;
  }

  public HttpStatus getHttpStatus() {
    return httpStatus;
  }
}
