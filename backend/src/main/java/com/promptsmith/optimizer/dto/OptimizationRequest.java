package com.promptsmith.optimizer.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/optimize}. Besides the free-form request, any task parameter (for
 * example {@code inputFields}, {@code sampleData}, {@code syntheticDataSize}) can be given at the
 * top level and overrides what would otherwise be inferred or defaulted.
 */
@Data
@NoArgsConstructor
@Schema(description = "Free-form task request with optional task parameter overrides")
public class OptimizationRequest {

  @Schema(
      description = "What the prompt should do, in the user's own words",
      example = "Classify the sentiment of product reviews")
  private String humanInput;

  @Schema(hidden = true)
  private Map<String, Object> overrides = new LinkedHashMap<>();

  public OptimizationRequest(String humanInput, Map<String, Object> overrides) {
    this.humanInput = humanInput;
    this.overrides = new LinkedHashMap<>(overrides);
  }

  @JsonAnySetter
  public void setOverride(String key, Object value) {
    overrides.put(key, value);
  }

  @JsonAnyGetter
  public Map<String, Object> getOverrides() {
    return overrides;
  }
}
