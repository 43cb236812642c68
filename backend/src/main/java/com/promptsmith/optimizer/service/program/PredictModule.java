package com.promptsmith.optimizer.service.program;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.promptsmith.optimizer.service.PromptService;
import com.promptsmith.optimizer.service.llm.BoundLanguageModel;
import com.promptsmith.optimizer.service.llm.ResponseParser;
import com.promptsmith.optimizer.service.signature.TaskSignature;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

/**
 * Basic predictor: renders the signature's instructions, its demonstrations and the inputs into one
 * prompt and reads the output fields back from a JSON answer. The other program variants wrap one
 * of these and add a reasoning strategy or tools.
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
public class PredictModule implements Program {

  private static final String TEMPLATE = "program";

  private final TaskSignature taskSignature;

  /** Extra guidance placed after the instructions, for example how to reason. */
  private final String strategy;

  /** Fields the model writes before the real outputs; they are dropped from the prediction. */
  @Singular private final List<String> auxiliaryOutputs;

  @Singular private final List<String> tools;
  @Singular("demo") private final List<Example> demoList;

  private final BoundLanguageModel model;
  private final PromptService promptService;
  private final ResponseParser responseParser;

  @Override
  public Prediction forward(Map<String, String> inputs) {
    String response = model.complete(renderPrompt(inputs));
    return parse(response);
  }

  String renderPrompt(Map<String, String> inputs) {
    Map<String, String> values = new HashMap<>();
    values.put("INSTRUCTIONS", taskSignature.getInstructions());
    values.put("STRATEGY", strategy);
    values.put("TOOLS", tools.stream().map(t -> "- " + t).collect(Collectors.joining("\n")));
    values.put(
        "DEMOS", demoList.stream().map(this::formatDemo).collect(Collectors.joining("\n\n")));
    values.put("INPUTS", formatFields(inputs, taskSignature.inputFieldNames()));
    values.put(
        "OUTPUT_KEYS",
        answerKeys().stream().map(k -> "\"" + k + "\"").collect(Collectors.joining(", ")));
    return promptService.render(TEMPLATE, values);
  }

  Prediction parse(String response) {
    List<String> outputs = taskSignature.outputFieldNames();
    Map<String, String> values = new LinkedHashMap<>();
    try {
      JsonNode answer = responseParser.readJson(response);
      if (answer.isObject()) {
        for (String field : outputs) {
          JsonNode value = answer.get(field);
          values.put(field, value == null || value.isNull() ? "" : textOf(value));
        }
        return new Prediction(values);
      }
    } catch (JsonProcessingException e) {
      log.debug("Answer is not JSON, falling back to raw text: {}", e.getOriginalMessage());
    }
    // single-output signatures accept a bare answer
    if (outputs.size() == 1 && auxiliaryOutputs.isEmpty()) {
      values.put(outputs.get(0), responseParser.stripCodeFences(response));
    } else {
      outputs.forEach(field -> values.put(field, ""));
    }
    return new Prediction(values);
  }

  private List<String> answerKeys() {
    List<String> keys = new ArrayList<>(auxiliaryOutputs);
    keys.addAll(taskSignature.outputFieldNames());
    return keys;
  }

  private String formatDemo(Example demo) {
    return formatFields(demo.getValues(), taskSignature.inputFieldNames())
        + "\n"
        + formatFields(demo.getValues(), taskSignature.outputFieldNames());
  }

  private static String formatFields(Map<String, String> values, List<String> keys) {
    return keys.stream()
        .map(key -> key + ": " + values.getOrDefault(key, ""))
        .collect(Collectors.joining("\n"));
  }

  private static String textOf(JsonNode value) {
    return value.isValueNode() ? value.asText() : value.toString();
  }

  @Override
  public Optional<TaskSignature> signature() {
    return Optional.of(taskSignature);
  }

  @Override
  public Optional<Program> predictor() {
    return Optional.empty();
  }

  @Override
  public List<Example> demos() {
    return demoList;
  }

  @Override
  public PredictModule withInstructions(String instructions) {
    return toBuilder().taskSignature(taskSignature.withInstructions(instructions)).build();
  }

  @Override
  public PredictModule withDemos(List<Example> demos) {
    return toBuilder().clearDemoList().demoList(demos).build();
  }
}
