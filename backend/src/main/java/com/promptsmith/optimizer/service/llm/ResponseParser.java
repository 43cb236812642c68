package com.promptsmith.optimizer.service.llm;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.CharMatcher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Pulls JSON out of free-form model answers. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseParser {

  private static final String JSON_FENCE = "```json";
  private static final String FENCE = "```";

  private final ObjectMapper objectMapper;

  /**
   * Removes a markdown code fence around the answer. Text after a {@code ```json} opener is kept
   * up to the next fence; a plain fence is handled the same way.
   */
  public String stripCodeFences(String response) {
    if (response == null) {
      return "";
    }
    String text = response.trim();
    int jsonFence = text.indexOf(JSON_FENCE);
    if (jsonFence >= 0) {
      text = text.substring(jsonFence + JSON_FENCE.length());
      int end = text.indexOf(FENCE);
      return (end >= 0 ? text.substring(0, end) : text).trim();
    }
    int fence = text.indexOf(FENCE);
    if (fence >= 0) {
      String rest = text.substring(fence + FENCE.length());
      int newline = rest.indexOf('\n');
      // drop a language tag on the opening fence line
      if (newline >= 0 && CharMatcher.anyOf("{[").matchesNoneOf(rest.substring(0, newline))) {
        rest = rest.substring(newline + 1);
      }
      int end = rest.indexOf(FENCE);
      return (end >= 0 ? rest.substring(0, end) : rest).trim();
    }
    return text;
  }

  /**
   * Parses the answer as JSON. When the cleaned text is not JSON on its own, the outermost
   * object or array embedded in it is tried.
   *
   * @throws JsonProcessingException when no JSON value can be read
   */
  public JsonNode readJson(String response) throws JsonProcessingException {
    String cleaned = stripCodeFences(response);
    try {
      return objectMapper.readTree(cleaned);
    } catch (JsonProcessingException e) {
      String embedded = extractEmbedded(cleaned);
      if (embedded == null) {
        log.debug("No JSON found in model answer: {}", truncateForLog(cleaned, 200));
        throw e;
      }
      return objectMapper.readTree(embedded);
    }
  }

  private String extractEmbedded(String text) {
    int objectStart = text.indexOf('{');
    int arrayStart = text.indexOf('[');
    int start;
    char close;
    if (arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart)) {
      start = arrayStart;
      close = ']';
    } else if (objectStart >= 0) {
      start = objectStart;
      close = '}';
    } else {
      return null;
    }
    int end = text.lastIndexOf(close);
    return end > start ? text.substring(start, end + 1) : null;
  }

  static String truncateForLog(String value, int max) {
    if (value == null || value.length() <= max) {
      return value;
    }
    return value.substring(0, max) + "...";
  }
}
