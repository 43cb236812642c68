package com.promptsmith.optimizer.exception;

public class OperationCancelledException extends OptimizerException {

  public OperationCancelledException(String message) {
    super(ErrorKind.CANCELLED, message);
  }
}
