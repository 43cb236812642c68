package com.promptsmith.optimizer.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Append-only, timestamped event log of one session. */
public class SessionEventLog {

  private final List<SessionEvent> events = new ArrayList<>();
  private final Clock clock;

  public SessionEventLog(Clock clock) {
    this.clock = clock;
  }

  public synchronized SessionEvent append(SessionEventType type, Map<String, Object> payload) {
    SessionEvent event = new SessionEvent(events.size() + 1L, Instant.now(clock), type, payload);
    events.add(event);
    return event;
  }

  public synchronized List<SessionEvent> snapshot() {
    return List.copyOf(events);
  }

  public synchronized int size() {
    return events.size();
  }

  public synchronized long count(SessionEventType type) {
    return events.stream().filter(e -> e.getType() == type).count();
  }

  /** Plain-text rendering, one line per event, for download. */
  public String formatTranscript(String sessionId) {
    StringBuilder out = new StringBuilder();
    out.append("Session ").append(sessionId).append('\n');
    for (SessionEvent event : snapshot()) {
      out.append('[')
          .append(event.getTimestamp())
          .append("] #")
          .append(event.getSequence())
          .append(' ')
          .append(event.getType());
      event
          .getPayload()
          .forEach((key, value) -> out.append(' ').append(key).append('=').append(render(value)));
      out.append('\n');
    }
    return out.toString();
  }

  private static String render(Object value) {
    if (value == null) {
      return "null";
    }
    String text = value.toString();
    return text.contains(" ") || text.contains("\n")
        ? "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\""
        : text;
  }
}
