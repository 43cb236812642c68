package com.promptsmith.optimizer.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.promptsmith.optimizer.exception.ErrorKind;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(
    description =
        "Outcome of one optimization pass: either the optimized prompt with its scores or an"
            + " error, never both")
public class OptimizationResult {

  @Schema(description = "Optimized instruction text")
  private String result;

  @Schema(description = "Session the pass belongs to")
  private String sessionId;

  @Schema(description = "Scores of the prompt before and after optimization")
  private Metrics metrics;

  @Schema(description = "Error message when the pass failed")
  private String error;

  @Schema(description = "Kind of failure, determines the HTTP status")
  private ErrorKind errorKind;

  @Schema(description = "Step that was running when the pass failed")
  private String stage;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Metrics {
    @Schema(description = "Score of the initial prompt on the validation set, 0-100")
    private double initialPromptScore;

    @Schema(description = "Score of the optimized prompt on the validation set, 0-100")
    private double optimizedPromptScore;
  }

  public static OptimizationResult success(
      String prompt, String sessionId, double initialScore, double optimizedScore) {
    return OptimizationResult.builder()
        .result(prompt)
        .sessionId(sessionId)
        .metrics(new Metrics(initialScore, optimizedScore))
        .build();
  }

  public static OptimizationResult failure(
      ErrorKind kind, String message, String stage, String sessionId) {
    return OptimizationResult.builder()
        .error(message)
        .errorKind(kind)
        .stage(stage)
        .sessionId(sessionId)
        .build();
  }

  @JsonIgnore
  public boolean isSuccess() {
    return error == null;
  }
}
