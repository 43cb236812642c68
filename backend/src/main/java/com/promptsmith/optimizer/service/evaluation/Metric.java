package com.promptsmith.optimizer.service.evaluation;

import com.promptsmith.optimizer.service.program.Example;
import com.promptsmith.optimizer.service.program.Prediction;

/** Scores one prediction against its labelled example, in {@code [0, 1]}. */
@FunctionalInterface
public interface Metric {

  double score(Example example, Prediction prediction);
}
