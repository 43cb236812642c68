package com.promptsmith.optimizer.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Re-optimize a session's prompt from its latest feedback")
public class OptimizeWithFeedbackRequest {

  @NotBlank(message = "sessionId is required")
  @Schema(description = "Session to refine")
  private String sessionId;
}
