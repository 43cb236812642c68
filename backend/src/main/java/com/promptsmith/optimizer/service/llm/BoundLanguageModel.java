package com.promptsmith.optimizer.service.llm;

/** A language model with its call parameters already fixed. */
@FunctionalInterface
public interface BoundLanguageModel {

  String complete(String prompt);

  default BoundLanguageModel withTemperature(double temperature) {
    return this;
  }
}
