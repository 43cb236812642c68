package com.promptsmith.optimizer.exception;

/** Raised when a synthetic-data batch stays malformed after its retry. */
public class DataGenerationException extends OptimizerException {

  public DataGenerationException(String message) {
    super(ErrorKind.DATA_GENERATION, message);
  }

  public DataGenerationException(String message, Throwable cause) {
    super(ErrorKind.DATA_GENERATION, message, cause);
  }
}
