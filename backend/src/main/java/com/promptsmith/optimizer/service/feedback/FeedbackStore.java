package com.promptsmith.optimizer.service.feedback;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/** Append-only, process-lifetime store of feedback entries keyed by session id. */
@Slf4j
@Component
public class FeedbackStore {

  private final List<Feedback> all = new CopyOnWriteArrayList<>();
  private final Map<String, List<Feedback>> bySession = new ConcurrentHashMap<>();
  private final Clock clock;

  @Autowired
  public FeedbackStore() {
    this(Clock.systemUTC());
  }

  FeedbackStore(Clock clock) {
    this.clock = clock;
  }

  public Feedback add(
      String text, int startOffset, int endOffset, String feedback, String promptId) {
    Feedback entry =
        Feedback.builder()
            .id(UUID.randomUUID().toString())
            .text(text)
            .startOffset(startOffset)
            .endOffset(endOffset)
            .feedback(feedback)
            .promptId(promptId)
            .createdAt(Instant.now(clock))
            .build();
    // both views are appended under the session list's lock so their orders agree
    List<Feedback> sessionList =
        bySession.computeIfAbsent(promptId, id -> new CopyOnWriteArrayList<>());
    synchronized (sessionList) {
      sessionList.add(entry);
      all.add(entry);
    }
    log.info("Stored feedback {} for session {}", entry.getId(), promptId);
    return entry;
  }

  /** Feedback of one session in insertion order. */
  public List<Feedback> getFeedbackForPrompt(String promptId) {
    return List.copyOf(bySession.getOrDefault(promptId, List.of()));
  }

  public List<Feedback> getAll() {
    return List.copyOf(all);
  }

  /** Entry with the greatest {@code createdAt}; on ties the later insertion wins. */
  public Optional<Feedback> latestFor(String promptId) {
    return latestOf(getFeedbackForPrompt(promptId));
  }

  public FeedbackAnalysis analyze(String promptId) {
    List<Feedback> considered = promptId == null ? getAll() : getFeedbackForPrompt(promptId);
    Map<String, Integer> perSession =
        considered.stream()
            .collect(
                Collectors.groupingBy(
                    Feedback::getPromptId,
                    LinkedHashMap::new,
                    Collectors.summingInt(f -> 1)));
    return FeedbackAnalysis.builder()
        .totalFeedback(considered.size())
        .feedbackPerSession(perSession)
        .latest(latestOf(considered).orElse(null))
        .build();
  }

  private static Optional<Feedback> latestOf(List<Feedback> entries) {
    Feedback latest = null;
    for (Feedback entry : entries) {
      if (latest == null || !entry.getCreatedAt().isBefore(latest.getCreatedAt())) {
        latest = entry;
      }
    }
    return Optional.ofNullable(latest);
  }
}
