package com.promptsmith.optimizer.service.execution;

import com.promptsmith.optimizer.exception.OperationCancelledException;

/** Cooperative cancellation flag checked by long-running steps between their blocking calls. */
public class CancellationToken {

  private volatile boolean cancelled;
  private volatile String reason;

  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel(String reason) {
    this.reason = reason;
    this.cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public String getReason() {
    return reason;
  }

  public void throwIfCancelled() {
    if (cancelled) {
      throw new OperationCancelledException(reason != null ? reason : "Operation cancelled");
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new OperationCancelledException("Operation interrupted");
    }
  }
}
