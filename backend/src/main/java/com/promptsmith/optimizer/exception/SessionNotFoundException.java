package com.promptsmith.optimizer.exception;

public class SessionNotFoundException extends OptimizerException {

  private final String sessionId;

  public SessionNotFoundException(String sessionId) {
    super(ErrorKind.SESSION_NOT_FOUND, "Session " + sessionId + " not found");
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
