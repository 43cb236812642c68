package com.promptsmith.optimizer.service.config;

import java.util.Locale;

import com.promptsmith.optimizer.exception.ConfigException;

/** Program module shapes that can be wrapped around a task signature. */
public enum ProgramVariant {
  /** Direct prediction of the output fields. */
  PREDICT,
  /** Step-by-step reasoning before the answer. */
  CHAIN_OF_THOUGHT,
  /** Reasons by writing a short program before answering. */
  PROGRAM_OF_THOUGHT,
  /** Agent loop over a list of externally supplied tools. */
  REACT;

  public boolean requiresTools() {
    return this == REACT;
  }

  public static ProgramVariant fromString(String value) {
    if (value == null || value.isBlank()) {
      return PREDICT;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith("dspy.")) {
      normalized = normalized.substring("dspy.".length());
    }
    normalized = normalized.replace("_", "").replace("-", "").replace(" ", "");
    switch (normalized) {
      case "predict":
        return PREDICT;
      case "chainofthought":
      case "cot":
        return CHAIN_OF_THOUGHT;
      case "programofthought":
      case "pot":
        return PROGRAM_OF_THOUGHT;
      case "react":
        return REACT;
      default:
        throw new ConfigException("Unknown program module: " + value);
    }
  }
}
