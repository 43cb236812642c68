package com.promptsmith.optimizer.service.execution;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.promptsmith.optimizer.exception.ErrorKind;
import com.promptsmith.optimizer.exception.OperationCancelledException;
import com.promptsmith.optimizer.exception.OptimizerException;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a blocking call on a separate thread and waits for it at most the given time. On timeout
 * the call is interrupted and the supplied exception is thrown; an interrupted caller cancels the
 * call and gets an {@link OperationCancelledException}.
 */
@Slf4j
@Component
public class TimeLimitedExecutor {

  private final ExecutorService executor;

  public TimeLimitedExecutor(@Qualifier("timeLimitedCallExecutor") ExecutorService executor) {
    this.executor = executor;
  }

  public <T> T call(
      Callable<T> task, Duration timeout, Supplier<? extends RuntimeException> onTimeout) {
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    Future<T> future =
        executor.submit(
            () -> {
              if (mdc != null) {
                MDC.setContextMap(mdc);
              }
              try {
                return task.call();
              } finally {
                MDC.clear();
              }
            });

    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Call exceeded its timeout of {} ms", timeout.toMillis());
      throw onTimeout.get();
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("Interrupted while waiting for a blocking call");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new OptimizerException(ErrorKind.INTERNAL, cause.getMessage(), cause);
    }
  }
}
