package com.promptsmith.optimizer.exception;

public class NoFeedbackFoundException extends OptimizerException {

  public NoFeedbackFoundException(String sessionId) {
    super(ErrorKind.NO_FEEDBACK_FOUND, "No feedback found for session " + sessionId);
  }
}
