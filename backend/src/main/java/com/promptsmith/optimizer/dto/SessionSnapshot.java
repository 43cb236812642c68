package com.promptsmith.optimizer.dto;

import java.time.Instant;
import java.util.List;

import com.promptsmith.optimizer.service.feedback.Feedback;
import com.promptsmith.optimizer.service.session.SessionEvent;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Read-only view of a session")
public class SessionSnapshot {

  String sessionId;
  String initialHumanInput;
  String updatedHumanInput;
  String latestOptimizedPrompt;
  Instant createdAt;
  String taskType;
  List<String> inputFields;
  List<String> outputFields;
  List<Feedback> feedback;

  @Schema(description = "Event log; omitted in session listings")
  List<SessionEvent> events;
}
