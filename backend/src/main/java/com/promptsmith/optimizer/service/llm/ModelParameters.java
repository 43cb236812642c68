package com.promptsmith.optimizer.service.llm;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** Per-call model settings: which provider/model to reach and how to sample. */
@Value
@Builder(toBuilder = true)
public class ModelParameters {

  String provider;
  String model;

  @ToString.Exclude String apiKey;

  String apiBase;
  Double temperature;
  Integer maxTokens;

  public ModelParameters withTemperature(double value) {
    return toBuilder().temperature(value).build();
  }
}
