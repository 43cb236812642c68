package com.promptsmith.optimizer.service.program;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Value;

/** Output fields a program produced for one input. */
@Value
public class Prediction {

  Map<String, String> values;

  public Prediction(Map<String, String> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public String get(String key) {
    return values.getOrDefault(key, "");
  }
}
