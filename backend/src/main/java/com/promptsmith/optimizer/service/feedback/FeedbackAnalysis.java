package com.promptsmith.optimizer.service.feedback;

import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Feedback counts, overall or for one session")
public class FeedbackAnalysis {

  @Schema(description = "Number of feedback entries considered")
  int totalFeedback;

  @Schema(description = "Feedback count per session id")
  Map<String, Integer> feedbackPerSession;

  @Schema(description = "Most recent feedback among those considered")
  Feedback latest;
}
