package com.promptsmith.optimizer.service.program;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.promptsmith.optimizer.service.signature.TaskSignature;

/**
 * Tool-using agent. The model is shown the available tools and records how it used them in a
 * {@code trajectory} field before answering.
 */
public class ReActProgram implements Program {

  private final PredictModule predict;

  ReActProgram(PredictModule base, List<String> tools) {
    this(
        base.toBuilder()
            .clearTools()
            .tools(tools)
            .strategy("Work in steps of thought, tool use and observation before answering.")
            .auxiliaryOutput("trajectory")
            .build());
  }

  private ReActProgram(PredictModule predict) {
    this.predict = predict;
  }

  public List<String> getTools() {
    return predict.getTools();
  }

  @Override
  public Prediction forward(Map<String, String> inputs) {
    return predict.forward(inputs);
  }

  @Override
  public Optional<TaskSignature> signature() {
    return predict.signature();
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
  public ReActProgram withInstructions(String instructions) {
    return new ReActProgram(predict.withInstructions(instructions));
  }

  @Override
  public ReActProgram withDemos(List<Example> demos) {
    return new ReActProgram(predict.withDemos(demos));
  }
}
