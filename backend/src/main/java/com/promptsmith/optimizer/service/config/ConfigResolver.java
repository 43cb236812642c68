package com.promptsmith.optimizer.service.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.promptsmith.optimizer.config.OptimizerProperties;
import com.promptsmith.optimizer.exception.ConfigException;
import com.promptsmith.optimizer.service.llm.ModelParameters;

import lombok.extern.slf4j.Slf4j;

/**
 * Validates raw task parameters (as bound from a JSON request) and normalizes them into a {@link
 * TaskConfig}. Missing optional values fall back to the {@code optimizer.*} defaults.
 */
@Slf4j
@Service
public class ConfigResolver {

  public static final String TASK = "task";
  public static final String RAW_INPUT = "rawInput";
  public static final String ORIGINAL_RAW_INPUT = "originalRawInput";
  public static final String TASK_TYPE = "taskType";
  public static final String INPUT_FIELDS = "inputFields";
  public static final String OUTPUT_FIELDS = "outputFields";
  public static final String SAMPLE_DATA = "sampleData";
  public static final String SYNTHETIC_DATA_SIZE = "syntheticDataSize";
  public static final String TRAIN_RATIO = "trainRatio";
  public static final String TRAIN_DATA_SIZE = "trainDataSize";
  public static final String TRAIN_DATA = "trainData";
  public static final String VALID_DATA = "validData";
  public static final String VALID_DATA_FULL = "validDataFull";
  public static final String PROGRAM_VARIANT = "programVariant";
  public static final String TOOLS = "tools";
  public static final String MODEL_PROVIDER = "modelProvider";
  public static final String MODEL_NAME = "modelName";
  public static final String MODEL_API_KEY = "modelApiKey";
  public static final String MODEL_API_BASE = "modelApiBase";
  public static final String TEMPERATURE = "temperature";
  public static final String MAX_TOKENS = "maxTokens";
  public static final String DATA_MODEL_NAME = "dataModelName";
  public static final String DATA_MODEL_API_KEY = "dataModelApiKey";
  public static final String DATA_MODEL_API_BASE = "dataModelApiBase";
  public static final String DATA_MAX_TOKENS = "dataMaxTokens";
  public static final String TRAINER_AUTO = "trainerAuto";
  public static final String NUM_CANDIDATES = "numCandidates";
  public static final String INIT_TEMPERATURE = "initTemperature";
  public static final String MAX_BOOTSTRAPPED_DEMOS = "maxBootstrappedDemos";
  public static final String MAX_LABELED_DEMOS = "maxLabeledDemos";
  public static final String NUM_TRIALS = "numTrials";
  public static final String MINIBATCH_SIZE = "minibatchSize";

  private static final CharMatcher ITEM_TRIM =
      CharMatcher.anyOf("\"'`").or(CharMatcher.whitespace());
  private static final Splitter LIST_SPLITTER =
      Splitter.on(',').trimResults(ITEM_TRIM).omitEmptyStrings();

  private final OptimizerProperties properties;
  private final ObjectMapper lenientMapper;

  public ConfigResolver(OptimizerProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.lenientMapper =
        objectMapper.copy().configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true);
  }

  public TaskConfig resolve(Map<String, Object> raw, String sessionId) {
    if (raw == null) {
      throw new ConfigException("Task parameters are required");
    }

    String rawInput = text(raw.get(RAW_INPUT));
    String task = text(raw.get(TASK));
    if (task == null) {
      task = rawInput;
    }
    if (task == null) {
      throw new ConfigException("A task description or raw input is required");
    }

    List<String> inputFields = parseFieldList(raw.get(INPUT_FIELDS), INPUT_FIELDS);
    List<String> outputFields = parseFieldList(raw.get(OUTPUT_FIELDS), OUTPUT_FIELDS);
    checkDisjoint(inputFields, outputFields);

    List<Map<String, String>> trainData = parseRecords(raw.get(TRAIN_DATA), TRAIN_DATA);
    List<Map<String, String>> validData = parseRecords(raw.get(VALID_DATA), VALID_DATA);
    List<Map<String, String>> validDataFull =
        parseRecords(raw.get(VALID_DATA_FULL), VALID_DATA_FULL);

    Map<String, String> sampleData = parseSampleData(raw.get(SAMPLE_DATA));
    if (sampleData.isEmpty() && !trainData.isEmpty()) {
      sampleData = trainData.get(0);
    }

    int syntheticDataSize;
    int trainDataSize;
    double trainRatio = doubleParam(raw, TRAIN_RATIO, properties.getTrainRatio());
    if (trainRatio <= 0 || trainRatio >= 1) {
      throw new ConfigException("trainRatio must be between 0 and 1 (exclusive)");
    }

    if (!trainData.isEmpty()) {
      if (validData.isEmpty()) {
        throw new ConfigException("validData is required when trainData is supplied");
      }
      trainDataSize = trainData.size();
      syntheticDataSize = trainData.size() + validData.size();
    } else {
      if (sampleData.isEmpty()) {
        throw new ConfigException("sampleData is required to generate synthetic examples");
      }
      checkSampleCoversFields(sampleData, inputFields, outputFields);
      syntheticDataSize =
          intParam(raw, SYNTHETIC_DATA_SIZE, properties.getSyntheticDataSize());
      if (syntheticDataSize < 1) {
        throw new ConfigException("syntheticDataSize must be at least 1");
      }
      trainDataSize =
          intValue(
              raw.get(TRAIN_DATA_SIZE),
              TRAIN_DATA_SIZE,
              Math.max(1, (int) Math.floor(syntheticDataSize * trainRatio)));
      if (trainDataSize < 1 || trainDataSize > syntheticDataSize) {
        throw new ConfigException(
            String.format(
                "trainDataSize must be between 1 and syntheticDataSize (%d), got %d",
                syntheticDataSize, trainDataSize));
      }
    }

    boolean fullEnabled = !validDataFull.isEmpty();

    ProgramVariant variant =
        ProgramVariant.fromString(
            firstText(raw.get(PROGRAM_VARIANT), properties.getProgramVariant()));
    List<String> tools = parseOptionalList(raw.get(TOOLS), TOOLS);
    if (variant.requiresTools() && tools.isEmpty()) {
      throw new ConfigException("The REACT program module requires at least one tool");
    }

    ModelParameters modelParameters = resolveModel(raw);
    ModelParameters dataModelParameters =
        modelParameters.toBuilder()
            .model(firstText(raw.get(DATA_MODEL_NAME), modelParameters.getModel()))
            .apiKey(firstText(raw.get(DATA_MODEL_API_KEY), modelParameters.getApiKey()))
            .apiBase(firstText(raw.get(DATA_MODEL_API_BASE), modelParameters.getApiBase()))
            .maxTokens(intParam(raw, DATA_MAX_TOKENS, modelParameters.getMaxTokens()))
            .build();

    TaskConfig config =
        TaskConfig.builder()
            .task(task)
            .rawInput(rawInput != null ? rawInput : task)
            .originalRawInput(
                firstText(raw.get(ORIGINAL_RAW_INPUT), rawInput != null ? rawInput : task))
            .taskType(TaskType.fromString(firstText(raw.get(TASK_TYPE), properties.getTaskType())))
            .inputFields(inputFields)
            .outputFields(outputFields)
            .sampleData(Collections.unmodifiableMap(sampleData))
            .syntheticDataSize(syntheticDataSize)
            .trainRatio(trainRatio)
            .trainDataSize(trainDataSize)
            .trainData(trainData)
            .validData(validData)
            .validDataFullEnabled(fullEnabled)
            .validDataFull(validDataFull)
            .programVariant(variant)
            .tools(tools)
            .trainerSettings(resolveTrainer(raw))
            .modelParameters(modelParameters)
            .dataModelParameters(dataModelParameters)
            .sessionId(sessionId)
            .build();

    log.info(
        "Resolved config session={} taskType={} inputs={} outputs={} synthetic={} train={} "
            + "module={}",
        sessionId,
        config.getTaskType(),
        inputFields,
        outputFields,
        syntheticDataSize,
        trainDataSize,
        variant);
    return config;
  }

  /**
   * Accepts a structured sequence or bracket-delimited text ({@code ["a", 'b']}, {@code [a, b]}
   * or {@code a, b}) and returns trimmed, unquoted names in order.
   */
  public List<String> parseFieldList(Object value, String key) {
    List<String> fields = parseOptionalList(value, key);
    if (fields.isEmpty()) {
      throw new ConfigException(key + " is required");
    }
    return fields;
  }

  private List<String> parseOptionalList(Object value, String key) {
    if (value == null) {
      return List.of();
    }
    List<String> result = new ArrayList<>();
    if (value instanceof List) {
      for (Object item : (List<?>) value) {
        if (item == null || item instanceof Map || item instanceof List) {
          throw new ConfigException(key + " contains an entry that is not a field name: " + item);
        }
        String name = ITEM_TRIM.trimFrom(item.toString());
        if (!name.isEmpty()) {
          result.add(name);
        }
      }
      return result;
    }
    if (value instanceof String) {
      String text = ((String) value).trim();
      boolean opens = text.startsWith("[");
      boolean closes = text.endsWith("]");
      if (opens != closes) {
        throw new ConfigException(key + " cannot be parsed: unbalanced brackets in '" + text + "'");
      }
      if (opens) {
        text = text.substring(1, text.length() - 1);
      }
      for (String item : LIST_SPLITTER.split(text)) {
        if (CharMatcher.anyOf("[]{}").matchesAnyOf(item)) {
          throw new ConfigException(key + " cannot be parsed: nested structure in '" + item + "'");
        }
        result.add(item);
      }
      return result;
    }
    throw new ConfigException(key + " must be a list or a bracket-delimited string");
  }

  /** Accepts a record, a list of records (the first is used) or JSON text of either. */
  public Map<String, String> parseSampleData(Object value) {
    if (value == null) {
      return new LinkedHashMap<>();
    }
    Object structured = value instanceof String ? readJson((String) value, SAMPLE_DATA) : value;
    if (structured instanceof List) {
      List<?> list = (List<?>) structured;
      if (list.isEmpty()) {
        return new LinkedHashMap<>();
      }
      structured = list.get(0);
    }
    if (!(structured instanceof Map)) {
      throw new ConfigException("sampleData must be a record of field names to values");
    }
    return stringifyRecord((Map<?, ?>) structured);
  }

  private List<Map<String, String>> parseRecords(Object value, String key) {
    if (value == null) {
      return List.of();
    }
    Object structured = value instanceof String ? readJson((String) value, key) : value;
    if (!(structured instanceof List)) {
      throw new ConfigException(key + " must be a list of records");
    }
    List<Map<String, String>> records = new ArrayList<>();
    for (Object item : (List<?>) structured) {
      if (!(item instanceof Map)) {
        throw new ConfigException(key + " contains an entry that is not a record");
      }
      records.add(Collections.unmodifiableMap(stringifyRecord((Map<?, ?>) item)));
    }
    return List.copyOf(records);
  }

  private Object readJson(String text, String key) {
    if (text.isBlank()) {
      return null;
    }
    try {
      return lenientMapper.readValue(text, Object.class);
    } catch (JsonProcessingException e) {
      throw new ConfigException(key + " is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  private Map<String, String> stringifyRecord(Map<?, ?> record) {
    Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : record.entrySet()) {
      result.put(String.valueOf(entry.getKey()), stringify(entry.getValue()));
    }
    return result;
  }

  private String stringify(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Map || value instanceof List) {
      try {
        return lenientMapper
            .writer()
            .without(SerializationFeature.INDENT_OUTPUT)
            .writeValueAsString(value);
      } catch (JsonProcessingException e) {
        throw new ConfigException(
            "Record value cannot be serialized: " + e.getOriginalMessage(), e);
      }
    }
    return value.toString();
  }

  private void checkDisjoint(List<String> inputs, List<String> outputs) {
    Set<String> overlap = new HashSet<>(inputs);
    overlap.retainAll(outputs);
    if (!overlap.isEmpty()) {
      throw new ConfigException("Input and output fields overlap: " + overlap);
    }
  }

  private void checkSampleCoversFields(
      Map<String, String> sample, List<String> inputs, List<String> outputs) {
    List<String> missing = new ArrayList<>();
    for (String field : inputs) {
      if (!sample.containsKey(field)) {
        missing.add(field);
      }
    }
    for (String field : outputs) {
      if (!sample.containsKey(field)) {
        missing.add(field);
      }
    }
    if (!missing.isEmpty()) {
      throw new ConfigException("sampleData is missing fields " + missing);
    }
  }

  private ModelParameters resolveModel(Map<String, Object> raw) {
    OptimizerProperties.Model defaults = properties.getModel();
    return ModelParameters.builder()
        .provider(firstText(raw.get(MODEL_PROVIDER), defaults.getProvider()))
        .model(firstText(raw.get(MODEL_NAME), defaults.getName()))
        .apiKey(text(raw.get(MODEL_API_KEY)))
        .apiBase(firstText(raw.get(MODEL_API_BASE), defaults.getApiBase()))
        .temperature(doubleParam(raw, TEMPERATURE, defaults.getTemperature()))
        .maxTokens(intParam(raw, MAX_TOKENS, defaults.getMaxTokens()))
        .build();
  }

  private TrainerSettings resolveTrainer(Map<String, Object> raw) {
    OptimizerProperties.Trainer defaults = properties.getTrainer();
    TrainerSettings settings =
        TrainerSettings.builder()
            .auto(firstText(raw.get(TRAINER_AUTO), defaults.getAuto()))
            .numCandidates(intParam(raw, NUM_CANDIDATES, defaults.getNumCandidates()))
            .initTemperature(
                doubleParam(raw, INIT_TEMPERATURE, defaults.getInitTemperature()))
            .maxBootstrappedDemos(
                intValue(
                    raw.get(MAX_BOOTSTRAPPED_DEMOS),
                    MAX_BOOTSTRAPPED_DEMOS,
                    defaults.getMaxBootstrappedDemos()))
            .maxLabeledDemos(
                intParam(raw, MAX_LABELED_DEMOS, defaults.getMaxLabeledDemos()))
            .numTrials(intParam(raw, NUM_TRIALS, defaults.getNumTrials()))
            .minibatchSize(intParam(raw, MINIBATCH_SIZE, defaults.getMinibatchSize()))
            .seed(defaults.getSeed())
            .build();
    if (settings.getNumCandidates() < 1 || settings.getNumTrials() < 1) {
      throw new ConfigException("numCandidates and numTrials must be at least 1");
    }
    if (settings.getMinibatchSize() < 1) {
      throw new ConfigException("minibatchSize must be at least 1");
    }
    if (settings.getMaxBootstrappedDemos() < 0 || settings.getMaxLabeledDemos() < 0) {
      throw new ConfigException("Demo limits cannot be negative");
    }
    return settings;
  }

  private static String text(Object value) {
    if (value == null) {
      return null;
    }
    String text = value.toString().trim();
    return text.isEmpty() ? null : text;
  }

  private static String firstText(Object value, String fallback) {
    String text = text(value);
    return text != null ? text : fallback;
  }

  private static Integer intParam(Map<String, Object> raw, String key, Integer fallback) {
    return intValue(raw.get(key), key, fallback);
  }

  private static double doubleParam(Map<String, Object> raw, String key, double fallback) {
    return doubleValue(raw.get(key), key, fallback);
  }

  private static Integer intValue(Object value, String key, Integer fallback) {
    if (value == null || (value instanceof String && ((String) value).isBlank())) {
      return fallback;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ConfigException(key + " must be an integer, got '" + value + "'");
    }
  }

  private static double doubleValue(Object value, String key, double fallback) {
    if (value == null || (value instanceof String && ((String) value).isBlank())) {
      return fallback;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ConfigException(key + " must be a number, got '" + value + "'");
    }
  }
}
