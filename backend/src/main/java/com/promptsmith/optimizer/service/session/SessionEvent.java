package com.promptsmith.optimizer.service.session;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Value;

/** Immutable entry of a session's event log. */
@Value
public class SessionEvent {

  long sequence;
  Instant timestamp;
  SessionEventType type;
  Map<String, Object> payload;

  public SessionEvent(
      long sequence, Instant timestamp, SessionEventType type, Map<String, Object> payload) {
    this.sequence = sequence;
    this.timestamp = timestamp;
    this.type = type;
    this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
