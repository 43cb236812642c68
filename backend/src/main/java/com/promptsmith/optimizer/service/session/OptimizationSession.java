package com.promptsmith.optimizer.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

import com.promptsmith.optimizer.service.config.TaskConfig;
import com.promptsmith.optimizer.service.execution.CancellationToken;
import com.promptsmith.optimizer.service.feedback.Feedback;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * State of one long-lived optimization conversation. Identity, initial input, creation time and
 * first-pass config never change; the latest prompt, the current input, the feedback list and the
 * event log evolve across passes.
 */
@Getter
public class OptimizationSession {

  private final String sessionId;
  private final String initialHumanInput;
  private final Instant createdAt;
  private final TaskConfig config;

  private volatile String updatedHumanInput;
  private volatile String latestOptimizedPrompt;
  private volatile boolean discarded;

  private final List<Feedback> feedback = new CopyOnWriteArrayList<>();
  private final SessionEventLog eventLog;

  /** Held for the whole of a pass; at most one pass per session runs at a time. */
  private final ReentrantLock passLock = new ReentrantLock();

  @Getter(AccessLevel.NONE)
  private final Set<InFlightPass> inFlight = ConcurrentHashMap.newKeySet();

  public OptimizationSession(
      String sessionId, String initialHumanInput, TaskConfig config, Clock clock) {
    this.sessionId = sessionId;
    this.initialHumanInput = initialHumanInput;
    this.config = config;
    this.createdAt = Instant.now(clock);
    this.updatedHumanInput = initialHumanInput;
    this.eventLog = new SessionEventLog(clock);
  }

  public SessionEvent record(SessionEventType type, Map<String, Object> payload) {
    return eventLog.append(type, payload);
  }

  public void updateOptimizedPrompt(String prompt) {
    this.latestOptimizedPrompt = prompt;
    record(SessionEventType.PROMPT_UPDATE, Map.of("prompt", prompt));
  }

  public void updateHumanInput(String input) {
    this.updatedHumanInput = input;
    record(SessionEventType.INPUT_UPDATE, Map.of("input", input));
  }

  public void addFeedback(Feedback entry) {
    feedback.add(entry);
    record(
        SessionEventType.COMMENT_ADDED,
        Map.of(
            "feedbackId",
            entry.getId(),
            "text",
            entry.getText(),
            "feedback",
            entry.getFeedback()));
  }

  public List<Feedback> getFeedback() {
    return List.copyOf(feedback);
  }

  /** Text the next feedback pass refines: the latest optimized prompt, else the current input. */
  public String currentPromptText() {
    String prompt = latestOptimizedPrompt;
    return prompt != null ? prompt : updatedHumanInput;
  }

  void markDiscarded() {
    this.discarded = true;
  }

  void register(InFlightPass pass) {
    inFlight.add(pass);
  }

  void unregister(InFlightPass pass) {
    inFlight.remove(pass);
  }

  /** Cancels every queued or running pass of this session. */
  int cancelPasses(String reason) {
    int cancelled = 0;
    for (InFlightPass pass : inFlight) {
      pass.token.cancel(reason);
      Future<?> future = pass.future;
      if (future != null) {
        future.cancel(true);
      }
      cancelled++;
    }
    return cancelled;
  }

  static final class InFlightPass {
    private final CancellationToken token;
    private volatile Future<?> future;

    InFlightPass(CancellationToken token) {
      this.token = token;
    }

    CancellationToken getToken() {
      return token;
    }

    void attach(Future<?> future) {
      this.future = future;
    }
  }
}
