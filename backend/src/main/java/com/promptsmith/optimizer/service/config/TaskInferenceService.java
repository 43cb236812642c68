package com.promptsmith.optimizer.service.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptsmith.optimizer.config.OptimizerProperties;
import com.promptsmith.optimizer.exception.ConfigException;
import com.promptsmith.optimizer.service.PromptService;
import com.promptsmith.optimizer.service.llm.LanguageModelGateway;
import com.promptsmith.optimizer.service.llm.ModelParameters;
import com.promptsmith.optimizer.service.llm.ResponseParser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fills in the task structure a free-form request leaves out (description, type, fields, sample
 * record and program variant) with one language-model call. Values the caller supplied always
 * win over inferred ones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskInferenceService {

  private static final String TEMPLATE = "task-inference";

  private final LanguageModelGateway languageModelGateway;
  private final PromptService promptService;
  private final ResponseParser responseParser;
  private final ObjectMapper objectMapper;
  private final OptimizerProperties properties;

  /** True when the parameters lack something only inference can supply. */
  public boolean needsInference(Map<String, Object> params) {
    return isMissing(params.get(ConfigResolver.INPUT_FIELDS))
        || isMissing(params.get(ConfigResolver.OUTPUT_FIELDS))
        || (isMissing(params.get(ConfigResolver.SAMPLE_DATA))
            && isMissing(params.get(ConfigResolver.TRAIN_DATA)));
  }

  /**
   * Returns a copy of {@code params} completed with inferred values. When nothing is missing the
   * copy is returned without calling the model.
   */
  public Map<String, Object> complete(String humanInput, Map<String, Object> params) {
    Map<String, Object> merged = new LinkedHashMap<>(params);
    if (humanInput != null && !humanInput.isBlank()) {
      merged.putIfAbsent(ConfigResolver.RAW_INPUT, humanInput);
      merged.putIfAbsent(ConfigResolver.ORIGINAL_RAW_INPUT, humanInput);
    }
    if (!needsInference(merged)) {
      return merged;
    }
    if (humanInput == null || humanInput.isBlank()) {
      throw new ConfigException("humanInput is required when the task structure is not supplied");
    }

    log.info("Inferring task structure from human input ({} chars)", humanInput.length());
    String prompt = promptService.render(TEMPLATE, Map.of("HUMAN_INPUT", humanInput));
    String response = languageModelGateway.complete(prompt, modelFor(merged));

    JsonNode inferred;
    try {
      inferred = responseParser.readJson(response);
    } catch (JsonProcessingException e) {
      throw new ConfigException(
          "Task structure could not be inferred: model answer is not JSON", e);
    }
    if (!inferred.isObject()) {
      throw new ConfigException("Task structure could not be inferred: expected a JSON object");
    }

    putIfMissing(merged, ConfigResolver.TASK, textOf(inferred, "task_description"));
    putIfMissing(merged, ConfigResolver.TASK_TYPE, textOf(inferred, "task_type"));
    putIfMissing(merged, ConfigResolver.INPUT_FIELDS, listOf(inferred, "input_fields"));
    putIfMissing(merged, ConfigResolver.OUTPUT_FIELDS, listOf(inferred, "output_fields"));
    putIfMissing(merged, ConfigResolver.PROGRAM_VARIANT, textOf(inferred, "program_variant"));
    if (isMissing(merged.get(ConfigResolver.TRAIN_DATA))) {
      putIfMissing(merged, ConfigResolver.SAMPLE_DATA, recordOf(inferred, "sample_data"));
    }

    log.info(
        "Inferred taskType={} inputs={} outputs={}",
        merged.get(ConfigResolver.TASK_TYPE),
        merged.get(ConfigResolver.INPUT_FIELDS),
        merged.get(ConfigResolver.OUTPUT_FIELDS));
    return merged;
  }

  private ModelParameters modelFor(Map<String, Object> params) {
    OptimizerProperties.Model defaults = properties.getModel();
    return ModelParameters.builder()
        .provider(stringOr(params.get(ConfigResolver.MODEL_PROVIDER), defaults.getProvider()))
        .model(stringOr(params.get(ConfigResolver.MODEL_NAME), defaults.getName()))
        .apiKey(stringOr(params.get(ConfigResolver.MODEL_API_KEY), null))
        .apiBase(stringOr(params.get(ConfigResolver.MODEL_API_BASE), defaults.getApiBase()))
        .temperature(0.0)
        .maxTokens(defaults.getMaxTokens())
        .build();
  }

  private static void putIfMissing(Map<String, Object> target, String key, Object value) {
    if (isMissing(target.get(key)) && !isMissing(value)) {
      target.put(key, value);
    }
  }

  private static boolean isMissing(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof String) {
      return ((String) value).isBlank();
    }
    if (value instanceof List) {
      return ((List<?>) value).isEmpty();
    }
    if (value instanceof Map) {
      return ((Map<?, ?>) value).isEmpty();
    }
    return false;
  }

  private static String stringOr(Object value, String fallback) {
    return value == null || value.toString().isBlank() ? fallback : value.toString();
  }

  private static String textOf(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static List<String> listOf(JsonNode node, String field) {
    JsonNode value = node.get(field);
    List<String> result = new ArrayList<>();
    if (value == null || value.isNull()) {
      return result;
    }
    if (value.isArray()) {
      value.forEach(item -> result.add(item.asText()));
    } else {
      result.add(value.asText());
    }
    return result;
  }

  private Map<String, Object> recordOf(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return Map.of();
    }
    if (value.isArray() && value.size() > 0) {
      value = value.get(0);
    }
    if (!value.isObject()) {
      return Map.of();
    }
    return objectMapper.convertValue(value, new TypeReference<LinkedHashMap<String, Object>>() {});
  }
}
