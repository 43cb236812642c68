package com.promptsmith.optimizer.service.program;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Value;

/** A labelled record with the subset of its fields that a program receives as input. */
@Value
public class Example {

  Map<String, String> values;
  List<String> inputKeys;

  public Example(Map<String, String> values, List<String> inputKeys) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    this.inputKeys = List.copyOf(inputKeys);
  }

  public static Example of(Map<String, String> values, List<String> inputKeys) {
    return new Example(values, inputKeys);
  }

  public String get(String key) {
    return values.get(key);
  }

  public Map<String, String> inputs() {
    Map<String, String> inputs = new LinkedHashMap<>();
    for (String key : inputKeys) {
      inputs.put(key, values.getOrDefault(key, ""));
    }
    return inputs;
  }

  public Map<String, String> labels() {
    Map<String, String> labels = new LinkedHashMap<>(values);
    inputKeys.forEach(labels::remove);
    return labels;
  }
}
