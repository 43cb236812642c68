package com.promptsmith.optimizer.service.feedback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FeedbackStore Tests")
class FeedbackStoreTest {

  private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Instant T2 = Instant.parse("2024-05-01T10:05:00Z");

  @Test
  @DisplayName("Should keep feedback per session in insertion order")
  void shouldKeepInsertionOrder() {
    FeedbackStore store = new FeedbackStore(Clock.fixed(T1, ZoneOffset.UTC));

    Feedback first = store.add("Be concise", 0, 2, "shorter", "s1");
    store.add("Other", 0, 5, "unrelated", "s2");
    Feedback second = store.add("Be concise", 3, 10, "friendlier", "s1");

    assertThat(store.getFeedbackForPrompt("s1")).containsExactly(first, second);
    assertThat(store.getAll()).hasSize(3);
    assertThat(store.getFeedbackForPrompt("unknown")).isEmpty();
    assertThat(first.getId()).isNotEqualTo(second.getId());
    assertThat(first.getCreatedAt()).isEqualTo(T1);
  }

  @Test
  @DisplayName("Should pick the entry with the latest timestamp")
  void shouldPickLatestTimestamp() {
    Clock clock = mock(Clock.class);
    when(clock.instant()).thenReturn(T2, T1);
    FeedbackStore store = new FeedbackStore(clock);

    Feedback newer = store.add("p", 0, 1, "newer", "s1");
    store.add("p", 0, 1, "older", "s1");

    assertThat(store.latestFor("s1")).contains(newer);
  }

  @Test
  @DisplayName("Should prefer the later insertion on equal timestamps")
  void shouldBreakTiesByInsertion() {
    FeedbackStore store = new FeedbackStore(Clock.fixed(T1, ZoneOffset.UTC));

    store.add("p", 0, 1, "first", "s1");
    Feedback last = store.add("p", 0, 1, "second", "s1");

    assertThat(store.latestFor("s1")).contains(last);
  }

  @Test
  @DisplayName("Should find nothing for a session without feedback")
  void shouldFindNothing() {
    assertThat(new FeedbackStore().latestFor("s1")).isEmpty();
  }

  @Test
  @DisplayName("Should count feedback per session")
  void shouldAnalyze() {
    FeedbackStore store = new FeedbackStore(Clock.fixed(T1, ZoneOffset.UTC));
    store.add("p", 0, 1, "a", "s1");
    store.add("p", 0, 1, "b", "s2");
    Feedback last = store.add("p", 0, 1, "c", "s1");

    FeedbackAnalysis all = store.analyze(null);
    FeedbackAnalysis one = store.analyze("s2");

    assertThat(all.getTotalFeedback()).isEqualTo(3);
    assertThat(all.getFeedbackPerSession()).containsEntry("s1", 2).containsEntry("s2", 1);
    assertThat(all.getLatest()).isEqualTo(last);
    assertThat(one.getTotalFeedback()).isEqualTo(1);
    assertThat(one.getFeedbackPerSession()).containsOnlyKeys("s2");
  }
}
