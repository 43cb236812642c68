package com.promptsmith.optimizer.service.optimization;

import java.util.List;

import com.promptsmith.optimizer.service.config.TrainerSettings;
import com.promptsmith.optimizer.service.evaluation.Metric;
import com.promptsmith.optimizer.service.execution.CancellationToken;
import com.promptsmith.optimizer.service.llm.BoundLanguageModel;
import com.promptsmith.optimizer.service.program.Example;
import com.promptsmith.optimizer.service.program.Program;

import lombok.Builder;
import lombok.Value;

/** Everything a trainer needs to compile one program. */
@Value
@Builder
public class TrainingSpec {

  Program program;
  Metric metric;
  List<Example> trainset;
  List<Example> valset;
  TrainerSettings settings;

  /** Model used to propose new instructions. */
  BoundLanguageModel proposer;

  @Builder.Default CancellationToken cancellationToken = CancellationToken.none();
}
