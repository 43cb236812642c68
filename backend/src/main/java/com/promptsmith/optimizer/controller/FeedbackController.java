package com.promptsmith.optimizer.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.promptsmith.optimizer.dto.FeedbackRequest;
import com.promptsmith.optimizer.service.PromptOptimizationService;
import com.promptsmith.optimizer.service.feedback.Feedback;
import com.promptsmith.optimizer.service.feedback.FeedbackAnalysis;
import com.promptsmith.optimizer.service.feedback.FeedbackStore;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/comments")
@Tag(name = "Feedback", description = "Feedback anchored to spans of optimized prompts")
public class FeedbackController {

  private final PromptOptimizationService promptOptimizationService;
  private final FeedbackStore feedbackStore;

  @PostMapping
  @Operation(summary = "Add feedback", description = "Stores feedback on a span of a prompt")
  public ResponseEntity<Feedback> addFeedback(@Valid @RequestBody FeedbackRequest request) {
    Feedback feedback =
        promptOptimizationService.addFeedback(
            request.getText(),
            request.getStartOffset(),
            request.getEndOffset(),
            request.getFeedback(),
            request.getPromptId());
    return ResponseEntity.status(HttpStatus.CREATED).body(feedback);
  }

  @GetMapping
  @Operation(summary = "List feedback", description = "All feedback in insertion order")
  public ResponseEntity<List<Feedback>> listFeedback() {
    return ResponseEntity.ok(promptOptimizationService.getAllFeedback());
  }

  @GetMapping("/analysis")
  @Operation(
      summary = "Analyze feedback",
      description = "Feedback counts per session and the latest entry, optionally for one session")
  public ResponseEntity<FeedbackAnalysis> analyze(
      @RequestParam(name = "promptId", required = false) String promptId) {
    return ResponseEntity.ok(feedbackStore.analyze(promptId));
  }
}
