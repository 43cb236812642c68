package com.promptsmith.optimizer.exception;

import java.time.Duration;

public class LanguageModelTimeoutException extends OptimizerException {

  public LanguageModelTimeoutException(String model, Duration timeout) {
    super(
        ErrorKind.LANGUAGE_MODEL_TIMEOUT,
        String.format(
            "Language model '%s' did not answer within %d ms", model, timeout.toMillis()));
  }
}
