package com.promptsmith.optimizer.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Feedback on a span of an optimized prompt")
public class FeedbackRequest {

  @NotBlank(message = "text is required")
  @Schema(description = "Text the feedback is anchored to")
  private String text;

  @NotNull(message = "startOffset is required")
  @Min(value = 0, message = "startOffset must not be negative")
  private Integer startOffset;

  @NotNull(message = "endOffset is required")
  @Min(value = 0, message = "endOffset must not be negative")
  private Integer endOffset;

  @NotBlank(message = "feedback is required")
  @Schema(description = "What should change")
  private String feedback;

  @NotBlank(message = "promptId is required")
  @Schema(description = "Session id of the prompt")
  private String promptId;
}
