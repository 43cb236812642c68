package com.promptsmith.optimizer.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.promptsmith.optimizer.dto.OptimizationResult;
import com.promptsmith.optimizer.dto.SessionSnapshot;
import com.promptsmith.optimizer.exception.ConfigException;
import com.promptsmith.optimizer.exception.ErrorKind;
import com.promptsmith.optimizer.exception.NoFeedbackFoundException;
import com.promptsmith.optimizer.exception.OptimizerException;
import com.promptsmith.optimizer.service.config.ConfigResolver;
import com.promptsmith.optimizer.service.config.TaskConfig;
import com.promptsmith.optimizer.service.config.TaskInferenceService;
import com.promptsmith.optimizer.service.feedback.Feedback;
import com.promptsmith.optimizer.service.feedback.FeedbackStore;
import com.promptsmith.optimizer.service.optimization.OptimizationOrchestrator;
import com.promptsmith.optimizer.service.session.OptimizationSession;
import com.promptsmith.optimizer.service.session.SessionEventType;
import com.promptsmith.optimizer.service.session.SessionManager;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for callers: starts sessions, re-optimizes them from feedback and records feedback
 * and input changes. Optimization failures come back as error results, never as exceptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromptOptimizationService {

  static final String STAGE_CONFIG = "config";
  static final String STAGE_FEEDBACK = "feedback";
  static final String STAGE_SESSION = "session";

  private final TaskInferenceService taskInferenceService;
  private final ConfigResolver configResolver;
  private final OptimizationOrchestrator orchestrator;
  private final SessionManager sessionManager;
  private final FeedbackStore feedbackStore;

  /** Starts a new session for {@code humanInput} and runs its first optimization pass. */
  public OptimizationResult optimize(String humanInput, Map<String, Object> overrides) {
    String sessionId = UUID.randomUUID().toString();
    TaskConfig config;
    try {
      Map<String, Object> params =
          taskInferenceService.complete(humanInput, overrides == null ? Map.of() : overrides);
      config = configResolver.resolve(params, sessionId);
    } catch (OptimizerException e) {
      log.warn("Rejected optimization request: {}", e.getMessage());
      return OptimizationResult.failure(e.getKind(), e.getMessage(), STAGE_CONFIG, sessionId);
    }

    OptimizationSession session =
        sessionManager.create(
            sessionId, humanInput != null ? humanInput : config.getRawInput(), config);
    return runPass(session, config, "optimization");
  }

  /**
   * Refines the session's prompt with its most recent feedback. Reading the feedback, the pass
   * and the prompt update all happen while the session is held exclusively.
   */
  public OptimizationResult optimizeWithFeedback(String sessionId) {
    OptimizationSession session;
    try {
      session = sessionManager.require(sessionId);
    } catch (OptimizerException e) {
      return OptimizationResult.failure(e.getKind(), e.getMessage(), STAGE_SESSION, sessionId);
    }

    try {
      return sessionManager.runExclusive(
          sessionId,
          token -> {
            Feedback latest =
                feedbackStore
                    .latestFor(sessionId)
                    .orElseThrow(() -> new NoFeedbackFoundException(sessionId));
            TaskConfig config = feedbackConfig(session, latest);
            log.info("Re-optimizing session {} with feedback {}", sessionId, latest.getId());
            OptimizationResult result = orchestrator.run(config, token);
            recordOutcome(session, result, "feedback_optimization");
            return result;
          });
    } catch (RuntimeException e) {
      return failed(session, e, STAGE_FEEDBACK);
    }
  }

  /** Stores feedback and attaches it to its session when that session exists. */
  public Feedback addFeedback(
      String text, int startOffset, int endOffset, String feedback, String promptId) {
    if (text == null) {
      throw new ConfigException("text is required");
    }
    if (startOffset < 0 || startOffset > endOffset || endOffset > text.length()) {
      throw new ConfigException(
          String.format(
              "Offsets must satisfy 0 <= startOffset <= endOffset <= %d, got %d..%d",
              text.length(), startOffset, endOffset));
    }
    Feedback entry = feedbackStore.add(text, startOffset, endOffset, feedback, promptId);
    sessionManager.get(promptId).ifPresent(session -> session.addFeedback(entry));
    return entry;
  }

  public List<Feedback> getAllFeedback() {
    return feedbackStore.getAll();
  }

  public SessionSnapshot updateHumanInput(String sessionId, String input) {
    OptimizationSession session = sessionManager.require(sessionId);
    session.updateHumanInput(input);
    return snapshot(session, true);
  }

  public void discardSession(String sessionId) {
    sessionManager.discard(sessionId);
  }

  public SessionSnapshot getSession(String sessionId) {
    return snapshot(sessionManager.require(sessionId), true);
  }

  public List<SessionSnapshot> listSessions() {
    return sessionManager.list().stream()
        .map(session -> snapshot(session, false))
        .collect(Collectors.toList());
  }

  public String exportLog(String sessionId) {
    OptimizationSession session = sessionManager.require(sessionId);
    return session.getEventLog().formatTranscript(sessionId);
  }

  TaskConfig feedbackConfig(OptimizationSession session, Feedback latest) {
    String task = "Prompt: " + session.currentPromptText() + "\nFeedback: " + latest.getFeedback();
    TaskConfig base = session.getConfig();
    return base.toBuilder()
        .task(task)
        .rawInput(task)
        .originalRawInput(session.getInitialHumanInput())
        .build();
  }

  private OptimizationResult runPass(
      OptimizationSession session, TaskConfig config, String stageOnError) {
    String sessionId = session.getSessionId();
    try {
      return sessionManager.runExclusive(
          sessionId,
          token -> {
            OptimizationResult result = orchestrator.run(config, token);
            recordOutcome(session, result, stageOnError);
            return result;
          });
    } catch (RuntimeException e) {
      return failed(session, e, stageOnError);
    }
  }

  private void recordOutcome(OptimizationSession session, OptimizationResult result, String stage) {
    if (result.isSuccess()) {
      session.updateOptimizedPrompt(result.getResult());
      return;
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("stage", result.getStage() != null ? result.getStage() : stage);
    payload.put("kind", result.getErrorKind());
    payload.put("error", result.getError());
    session.record(SessionEventType.ERROR, payload);
  }

  private OptimizationResult failed(OptimizationSession session, RuntimeException e, String stage) {
    ErrorKind kind = OptimizerException.kindOf(e);
    if (kind == ErrorKind.INTERNAL) {
      log.error("Session {} failed during {}", session.getSessionId(), stage, e);
    } else {
      log.warn("Session {} failed during {}: {}", session.getSessionId(), stage, e.getMessage());
    }
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("stage", stage);
    payload.put("kind", kind);
    payload.put("error", message);
    session.record(SessionEventType.ERROR, payload);
    return OptimizationResult.failure(kind, message, stage, session.getSessionId());
  }

  private SessionSnapshot snapshot(OptimizationSession session, boolean withEvents) {
    TaskConfig config = session.getConfig();
    return SessionSnapshot.builder()
        .sessionId(session.getSessionId())
        .initialHumanInput(session.getInitialHumanInput())
        .updatedHumanInput(session.getUpdatedHumanInput())
        .latestOptimizedPrompt(session.getLatestOptimizedPrompt())
        .createdAt(session.getCreatedAt())
        .taskType(config.getTaskType() != null ? config.getTaskType().name() : null)
        .inputFields(config.getInputFields())
        .outputFields(config.getOutputFields())
        .feedback(session.getFeedback())
        .events(withEvents ? session.getEventLog().snapshot() : null)
        .build();
  }
}
