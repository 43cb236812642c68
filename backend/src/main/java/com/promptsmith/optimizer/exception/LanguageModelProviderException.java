package com.promptsmith.optimizer.exception;

/** Raised when a language-model provider rejects or fails a call. */
public class LanguageModelProviderException extends OptimizerException {

  public LanguageModelProviderException(String message) {
    super(ErrorKind.LANGUAGE_MODEL_PROVIDER, message);
  }

  public LanguageModelProviderException(String message, Throwable cause) {
    super(ErrorKind.LANGUAGE_MODEL_PROVIDER, message, cause);
  }
}
