package com.promptsmith.optimizer.service.data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.promptsmith.optimizer.config.OptimizerProperties;
import com.promptsmith.optimizer.exception.DataGenerationException;
import com.promptsmith.optimizer.service.PromptService;
import com.promptsmith.optimizer.service.execution.CancellationToken;
import com.promptsmith.optimizer.service.llm.BoundLanguageModel;
import com.promptsmith.optimizer.service.llm.ResponseParser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fabricates example records shaped like a sample record. Records are requested in batches sized
 * so that each request stays within the configured token budget; the result always holds exactly
 * the requested number of records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyntheticDataGenerator {

  private static final String TEMPLATE = "synthetic-data";
  private static final int ATTEMPTS_PER_BATCH = 2;

  private final PromptService promptService;
  private final ResponseParser responseParser;
  private final ObjectMapper objectMapper;
  private final OptimizerProperties properties;

  public List<SyntheticExample> generate(
      Map<String, String> sample,
      int desiredCount,
      String task,
      BoundLanguageModel model,
      CancellationToken cancellationToken) {
    if (sample == null || sample.isEmpty()) {
      throw new DataGenerationException("A sample record is required to generate data");
    }
    if (desiredCount < 1) {
      return List.of();
    }

    OptimizerProperties.Synthetic settings = properties.getSynthetic();
    double tokenEstimate = (double) compactJson(sample).length() / settings.getCharsPerToken();
    int batchCap =
        maxBatchSize(tokenEstimate, settings.getTokenBudget(), settings.getMaxBatchSize());
    log.info(
        "Generating {} synthetic records (token estimate {}, batch size {})",
        desiredCount,
        String.format("%.1f", tokenEstimate),
        batchCap);

    List<SyntheticExample> generated = new ArrayList<>(desiredCount);
    int remaining = desiredCount;
    while (remaining > 0) {
      cancellationToken.throwIfCancelled();
      int batchSize = Math.min(batchCap, remaining);
      generated.addAll(generateBatch(sample, batchSize, task, model, cancellationToken));
      remaining -= batchSize;
      log.info("Generated {} samples out of {}", generated.size(), desiredCount);
    }
    return generated;
  }

  /**
   * Largest number of records per request: {@code floor(budget / tokenEstimate)} clamped to
   * {@code [1, cap]}. Estimates below one token yield the cap.
   */
  public static int maxBatchSize(double tokenEstimate, int tokenBudget, int cap) {
    if (tokenEstimate < 1) {
      return cap;
    }
    long perBudget = (long) Math.floor(tokenBudget / tokenEstimate);
    return (int) Math.max(1, Math.min(cap, perBudget));
  }

  private List<SyntheticExample> generateBatch(
      Map<String, String> sample,
      int batchSize,
      String task,
      BoundLanguageModel model,
      CancellationToken cancellationToken) {
    String prompt = buildPrompt(sample, batchSize, task);
    String lastProblem = null;
    for (int attempt = 1; attempt <= ATTEMPTS_PER_BATCH; attempt++) {
      cancellationToken.throwIfCancelled();
      String response = model.complete(prompt);
      try {
        return parseBatch(response, sample, batchSize);
      } catch (MalformedBatchException e) {
        lastProblem = e.getMessage();
        log.warn("Malformed batch of {} (attempt {}): {}", batchSize, attempt, lastProblem);
      }
    }
    throw new DataGenerationException(
        "Synthetic data batch of " + batchSize + " was malformed after retry: " + lastProblem);
  }

  String buildPrompt(Map<String, String> sample, int batchSize, String task) {
    Map<String, String> template = new LinkedHashMap<>();
    sample.keySet().forEach(key -> template.put(key, "..."));

    Map<String, String> values = new HashMap<>();
    values.put("BATCH_SIZE", String.valueOf(batchSize));
    values.put("SAMPLE", prettyJson(sample));
    values.put("KEYS", String.join(", ", sample.keySet()));
    values.put("TEMPLATE", prettyJson(List.of(template)));
    values.put("TASK", task);
    return promptService.render(TEMPLATE, values);
  }

  List<SyntheticExample> parseBatch(String response, Map<String, String> sample, int batchSize) {
    JsonNode root;
    try {
      root = responseParser.readJson(response);
    } catch (JsonProcessingException e) {
      throw new MalformedBatchException("answer is not JSON: " + e.getOriginalMessage());
    }
    if (!root.isArray()) {
      throw new MalformedBatchException("expected a JSON array but got " + root.getNodeType());
    }
    if (root.size() < batchSize) {
      throw new MalformedBatchException(
          "expected " + batchSize + " records but got " + root.size());
    }

    List<SyntheticExample> records = new ArrayList<>(batchSize);
    for (int i = 0; i < batchSize; i++) {
      JsonNode item = root.get(i);
      if (!item.isObject()) {
        throw new MalformedBatchException("record " + i + " is not an object");
      }
      Map<String, String> values = new LinkedHashMap<>();
      for (String key : sample.keySet()) {
        JsonNode value = item.get(key);
        if (value == null) {
          throw new MalformedBatchException("record " + i + " lacks key '" + key + "'");
        }
        values.put(key, value.isTextual() ? value.asText() : value.toString());
      }
      records.add(new SyntheticExample(values));
    }
    if (root.size() > batchSize) {
      log.debug("Dropping {} surplus records", root.size() - batchSize);
    }
    return records;
  }

  private String compactJson(Object value) {
    try {
      return objectMapper
          .writer()
          .without(SerializationFeature.INDENT_OUTPUT)
          .writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new DataGenerationException("Sample record cannot be serialized", e);
    }
  }

  private String prettyJson(Object value) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new DataGenerationException("Sample record cannot be serialized", e);
    }
  }

  private static final class MalformedBatchException extends RuntimeException {
    private MalformedBatchException(String message) {
      super(message);
    }
  }
}
