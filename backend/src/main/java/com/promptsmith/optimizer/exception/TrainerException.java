package com.promptsmith.optimizer.exception;

import java.time.Duration;

/** Wraps failures coming out of a trainer; the trainer's own message is passed through. */
public class TrainerException extends OptimizerException {

  public TrainerException(String message, Throwable cause) {
    super(ErrorKind.TRAINER, message, cause);
  }

  private TrainerException(ErrorKind kind, String message) {
    super(kind, message);
  }

  public static TrainerException timedOut(Duration timeout) {
    return new TrainerException(
        ErrorKind.TRAINER_TIMEOUT,
        "Trainer did not finish within " + timeout.toSeconds() + " s");
  }
}
