package com.promptsmith.optimizer.service.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Value;

/** One generated record, keyed like the sample it was modelled on. */
@Value
public class SyntheticExample {

  Map<String, String> values;

  public SyntheticExample(Map<String, String> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public String get(String field) {
    return values.get(field);
  }
}
