package com.promptsmith.optimizer.service.feedback;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "User feedback anchored to a span of an optimized prompt")
public class Feedback {

  @Schema(description = "Feedback identifier")
  String id;

  @Schema(description = "Text the feedback refers to")
  String text;

  @Schema(description = "Start offset of the anchored span")
  int startOffset;

  @Schema(description = "End offset of the anchored span (exclusive)")
  int endOffset;

  @Schema(description = "What the user wants changed")
  String feedback;

  @Schema(description = "Session the feedback belongs to")
  String promptId;

  Instant createdAt;
}
