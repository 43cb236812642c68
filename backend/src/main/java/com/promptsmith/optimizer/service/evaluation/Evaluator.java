package com.promptsmith.optimizer.service.evaluation;

import java.util.List;

import org.springframework.stereotype.Component;

import com.promptsmith.optimizer.exception.OptimizerException;
import com.promptsmith.optimizer.service.execution.CancellationToken;
import com.promptsmith.optimizer.service.program.Example;
import com.promptsmith.optimizer.service.program.Program;

import lombok.extern.slf4j.Slf4j;

/** Runs a program over a dev set and reports the mean metric score as a percentage. */
@Slf4j
@Component
public class Evaluator {

  public double evaluate(
      Program program, List<Example> devset, Metric metric, CancellationToken cancellationToken) {
    if (devset.isEmpty()) {
      return 0.0;
    }
    double total = 0;
    for (Example example : devset) {
      cancellationToken.throwIfCancelled();
      total += scoreOne(program, example, metric);
    }
    double score = 100.0 * total / devset.size();
    log.debug("Evaluated {} examples, score {}", devset.size(), String.format("%.2f", score));
    return score;
  }

  private double scoreOne(Program program, Example example, Metric metric) {
    try {
      double score = metric.score(example, program.forward(example.inputs()));
      return Math.max(0.0, Math.min(1.0, score));
    } catch (OptimizerException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("Example scored 0 after program failure: {}", e.getMessage());
      return 0.0;
    }
  }
}
