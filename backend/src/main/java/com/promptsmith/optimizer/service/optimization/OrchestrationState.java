package com.promptsmith.optimizer.service.optimization;

/** States of one optimization pass, in the order they are reached. */
public enum OrchestrationState {
  INIT("signature"),
  SIGNATURE_BUILT("data_preparation"),
  DATA_READY("baseline_evaluation"),
  BASELINE_EVALUATED("compile"),
  COMPILED("final_evaluation"),
  FINAL_EVALUATED("instruction_extraction"),
  DONE(null),
  ERROR(null);

  private final String nextStage;

  OrchestrationState(String nextStage) {
    this.nextStage = nextStage;
  }

  /** Name of the step that runs while the pass is in this state. */
  public String getNextStage() {
    return nextStage;
  }

  public boolean isTerminal() {
    return this == DONE || this == ERROR;
  }
}
