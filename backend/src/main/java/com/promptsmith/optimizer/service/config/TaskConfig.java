package com.promptsmith.optimizer.service.config;

import java.util.List;
import java.util.Map;

import com.promptsmith.optimizer.service.llm.ModelParameters;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Canonical, immutable configuration of one orchestration pass. Produced by {@link
 * ConfigResolver}; a feedback-driven pass derives a new instance with {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class TaskConfig {

  String task;
  String rawInput;
  String originalRawInput;
  TaskType taskType;

  @Singular List<String> inputFields;
  @Singular List<String> outputFields;

  /** One representative record; its keys define the schema of generated examples. */
  Map<String, String> sampleData;

  int syntheticDataSize;
  double trainRatio;
  int trainDataSize;

  /** Explicit training records; when present no synthetic data is generated. */
  List<Map<String, String>> trainData;

  List<Map<String, String>> validData;

  boolean validDataFullEnabled;

  /** Separately sourced, usually larger validation set used for scoring when enabled. */
  List<Map<String, String>> validDataFull;

  ProgramVariant programVariant;
  @Singular List<String> tools;

  TrainerSettings trainerSettings;

  /** Model the optimized prompt targets. */
  ModelParameters modelParameters;

  /** Model used to fabricate synthetic data. */
  ModelParameters dataModelParameters;

  String sessionId;

  public boolean hasExplicitTrainData() {
    return trainData != null && !trainData.isEmpty();
  }

  public String signatureName() {
    return (taskType == null ? TaskType.OTHER : taskType).name() + "Signature";
  }
}
