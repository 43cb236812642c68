package com.promptsmith.optimizer.service.session;

public enum SessionEventType {
  SESSION_START,
  PROMPT_UPDATE,
  INPUT_UPDATE,
  COMMENT_ADDED,
  ERROR,
  SESSION_DISCARDED
}
