package com.promptsmith.optimizer.exception;

/**
 * Base type for failures raised inside the optimization engine. Every subtype carries the {@link
 * ErrorKind} that ends up in the result handed back to callers.
 */
public class OptimizerException extends RuntimeException {

  private final ErrorKind kind;

  public OptimizerException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public OptimizerException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** Maps any throwable to the kind reported for it; unknown failures are {@code INTERNAL}. */
  public static ErrorKind kindOf(Throwable t) {
    if (t instanceof OptimizerException) {
      return ((OptimizerException) t).getKind();
    }
    return ErrorKind.INTERNAL;
  }
}
