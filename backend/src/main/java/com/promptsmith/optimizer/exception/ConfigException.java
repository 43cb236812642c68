package com.promptsmith.optimizer.exception;

/** Raised when task parameters are missing, malformed or inconsistent. */
public class ConfigException extends OptimizerException {

  public ConfigException(String message) {
    super(ErrorKind.CONFIG, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ErrorKind.CONFIG, message, cause);
  }
}
