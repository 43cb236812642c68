package com.promptsmith.optimizer.service.evaluation;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import org.springframework.stereotype.Component;

import com.promptsmith.optimizer.service.config.TaskType;

import lombok.extern.slf4j.Slf4j;

/**
 * Task-type keyed scoring. Each metric compares every output field of the signature and averages
 * the per-field scores.
 */
@Slf4j
@Component
public class MetricRegistry {

  private final Map<TaskType, BiFunction<String, String, Double>> fieldScorers =
      new EnumMap<>(TaskType.class);

  public MetricRegistry() {
    fieldScorers.put(TaskType.CLASSIFICATION, TextSimilarity::exactMatch);
    fieldScorers.put(TaskType.REASONING, TextSimilarity::exactMatch);
    fieldScorers.put(TaskType.QA, TextSimilarity::tokenF1);
    fieldScorers.put(TaskType.EXTRACTION, TextSimilarity::tokenF1);
    fieldScorers.put(TaskType.TRANSLATION, TextSimilarity::tokenF1);
    fieldScorers.put(TaskType.OTHER, TextSimilarity::tokenF1);
    fieldScorers.put(TaskType.GENERATION, TextSimilarity::longestCommonSubsequenceF1);
    fieldScorers.put(TaskType.SUMMARIZATION, TextSimilarity::longestCommonSubsequenceF1);
  }

  public Metric metricFor(TaskType taskType, List<String> outputFields) {
    TaskType type = taskType == null ? TaskType.OTHER : taskType;
    BiFunction<String, String, Double> scorer =
        fieldScorers.getOrDefault(type, TextSimilarity::tokenF1);
    List<String> fields = List.copyOf(outputFields);
    log.debug("Using {} metric over fields {}", type, fields);

    return (example, prediction) -> {
      if (fields.isEmpty()) {
        return 0.0;
      }
      double total = 0;
      for (String field : fields) {
        total += scorer.apply(example.get(field), prediction.get(field));
      }
      return total / fields.size();
    };
  }
}
