package com.promptsmith.optimizer.service.config;

import java.util.Locale;

/** Task categories; each one selects its scoring function from the metric registry. */
public enum TaskType {
  CLASSIFICATION,
  QA,
  GENERATION,
  SUMMARIZATION,
  TRANSLATION,
  EXTRACTION,
  REASONING,
  OTHER;

  /** Lenient parse for user input and model-inferred values; unknown text maps to OTHER. */
  public static TaskType fromString(String value) {
    if (value == null || value.isBlank()) {
      return OTHER;
    }
    String normalized =
        value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    switch (normalized) {
      case "classification":
      case "classify":
        return CLASSIFICATION;
      case "qa":
      case "question_answering":
      case "question_answer":
        return QA;
      case "generation":
      case "text_generation":
        return GENERATION;
      case "summarization":
      case "summary":
        return SUMMARIZATION;
      case "translation":
        return TRANSLATION;
      case "extraction":
      case "information_extraction":
        return EXTRACTION;
      case "reasoning":
      case "math":
        return REASONING;
      default:
        return OTHER;
    }
  }
}
