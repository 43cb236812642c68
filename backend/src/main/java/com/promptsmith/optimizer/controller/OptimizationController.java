package com.promptsmith.optimizer.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.promptsmith.optimizer.dto.OptimizationRequest;
import com.promptsmith.optimizer.dto.OptimizationResult;
import com.promptsmith.optimizer.dto.OptimizeWithFeedbackRequest;
import com.promptsmith.optimizer.service.PromptOptimizationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Optimization", description = "Prompt optimization passes")
public class OptimizationController {

  private final PromptOptimizationService promptOptimizationService;

  @PostMapping("/optimize")
  @Operation(
      summary = "Optimize a prompt",
      description =
          "Starts a session for the request, generates synthetic examples, optimizes the prompt"
              + " and returns it with before/after scores")
  public ResponseEntity<OptimizationResult> optimize(@RequestBody OptimizationRequest request) {
    log.info("Optimization requested ({} overrides)", request.getOverrides().size());
    OptimizationResult result =
        promptOptimizationService.optimize(request.getHumanInput(), request.getOverrides());
    return respond(result);
  }

  @PostMapping("/optimize-with-feedback")
  @Operation(
      summary = "Re-optimize from feedback",
      description = "Refines the session's latest prompt using its most recent feedback")
  public ResponseEntity<OptimizationResult> optimizeWithFeedback(
      @Valid @RequestBody OptimizeWithFeedbackRequest request) {
    log.info("Feedback optimization requested for session {}", request.getSessionId());
    return respond(promptOptimizationService.optimizeWithFeedback(request.getSessionId()));
  }

  static ResponseEntity<OptimizationResult> respond(OptimizationResult result) {
    if (result.isSuccess()) {
      return ResponseEntity.ok(result);
    }
    return ResponseEntity.status(result.getErrorKind().getHttpStatus()).body(result);
  }
}
