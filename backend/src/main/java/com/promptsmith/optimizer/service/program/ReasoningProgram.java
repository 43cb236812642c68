package com.promptsmith.optimizer.service.program;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.promptsmith.optimizer.service.signature.TaskSignature;

/**
 * Program that asks a nested predictor to write intermediate work before the answer. It owns no
 * signature itself; instructions live on {@link #predictor()}.
 */
public class ReasoningProgram implements Program {

  private final PredictModule predict;

  ReasoningProgram(PredictModule predict) {
    this.predict = predict;
  }

  static ReasoningProgram chainOfThought(PredictModule base) {
    return new ReasoningProgram(
        base.toBuilder()
            .strategy(
                "Think step by step. Write your reasoning in the \"reasoning\" field before"
                    + " giving the answer fields.")
            .auxiliaryOutput("reasoning")
            .build());
  }

  static ReasoningProgram programOfThought(PredictModule base) {
    return new ReasoningProgram(
        base.toBuilder()
            .strategy(
                "Solve the task by writing a short program in the \"code\" field that computes"
                    + " the answer, then report the values that program produces in the answer"
                    + " fields.")
            .auxiliaryOutput("code")
            .build());
  }

  @Override
  public Prediction forward(Map<String, String> inputs) {
    return predict.forward(inputs);
  }

  @Override
  public Optional<TaskSignature> signature() {
    return Optional.empty();
  }

  @Override
  public Optional<Program> predictor() {
    return Optional.of(predict);
  }

  @Override
  public List<Example> demos() {
    return predict.demos();
  }

  @Override
  public ReasoningProgram withInstructions(String instructions) {
    return new ReasoningProgram(predict.withInstructions(instructions));
  }

  @Override
  public ReasoningProgram withDemos(List<Example> demos) {
    return new ReasoningProgram(predict.withDemos(demos));
  }
}
