package com.promptsmith.optimizer.UnitTests.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.promptsmith.optimizer.controller.OptimizationController;
import com.promptsmith.optimizer.dto.OptimizationResult;
import com.promptsmith.optimizer.exception.ErrorKind;
import com.promptsmith.optimizer.service.PromptOptimizationService;

@WebMvcTest(OptimizationController.class)
@DisplayName("OptimizationController Tests")
class OptimizationControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private PromptOptimizationService promptOptimizationService;

  @Nested
  @DisplayName("POST /api/optimize")
  class OptimizeTests {

    @Test
    @DisplayName("Should return the optimized prompt with its scores")
    void shouldReturnOptimizedPrompt() throws Exception {
      // Given
      when(promptOptimizationService.optimize(anyString(), any()))
          .thenReturn(OptimizationResult.success("Label each review.", "s-1", 42.5, 80.0));

      // When & Then
      mockMvc
          .perform(
              post("/api/optimize")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"humanInput\":\"Classify reviews\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.result").value("Label each review."))
          .andExpect(jsonPath("$.sessionId").value("s-1"))
          .andExpect(jsonPath("$.metrics.initialPromptScore").value(42.5))
          .andExpect(jsonPath("$.metrics.optimizedPromptScore").value(80.0))
          .andExpect(jsonPath("$.error").doesNotExist())
          .andExpect(header().exists("X-Correlation-Id"));
    }

    @Test
    @DisplayName("Should pass top-level task parameters through as overrides")
    @SuppressWarnings("unchecked")
    void shouldPassOverrides() throws Exception {
      // Given
      when(promptOptimizationService.optimize(anyString(), any()))
          .thenReturn(OptimizationResult.success("p", "s-1", 0.0, 0.0));

      // When
      mockMvc
          .perform(
              post("/api/optimize")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      "{\"humanInput\":\"Classify reviews\",\"syntheticDataSize\":10,"
                          + "\"outputFields\":[\"sentiment\"]}"))
          .andExpect(status().isOk());

      // Then
      ArgumentCaptor<Map<String, Object>> overrides = ArgumentCaptor.forClass(Map.class);
      verify(promptOptimizationService).optimize(eq("Classify reviews"), overrides.capture());
      assertThat(overrides.getValue())
          .containsEntry("syntheticDataSize", 10)
          .containsKey("outputFields")
          .doesNotContainKey("humanInput");
    }

    @Test
    @DisplayName("Should map a config failure to 400 with its stage")
    void shouldMapConfigFailure() throws Exception {
      // Given
      when(promptOptimizationService.optimize(any(), any()))
          .thenReturn(
              OptimizationResult.failure(
                  ErrorKind.CONFIG, "outputFields is required", "config", "s-1"));

      // When & Then
      mockMvc
          .perform(post("/api/optimize").contentType(MediaType.APPLICATION_JSON).content("{}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.error").value("outputFields is required"))
          .andExpect(jsonPath("$.errorKind").value("CONFIG"))
          .andExpect(jsonPath("$.stage").value("config"))
          .andExpect(jsonPath("$.result").doesNotExist());
    }

    @Test
    @DisplayName("Should map a language model timeout to 504")
    void shouldMapTimeout() throws Exception {
      // Given
      when(promptOptimizationService.optimize(any(), any()))
          .thenReturn(
              OptimizationResult.failure(
                  ErrorKind.LANGUAGE_MODEL_TIMEOUT, "too slow", "compile", "s-1"));

      // When & Then
      mockMvc
          .perform(
              post("/api/optimize")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"humanInput\":\"x\"}"))
          .andExpect(status().isGatewayTimeout())
          .andExpect(jsonPath("$.stage").value("compile"));
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() throws Exception {
      mockMvc
          .perform(
              post("/api/optimize").contentType(MediaType.APPLICATION_JSON).content("{ bad"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.errorKind").value("CONFIG"));
    }
  }

  @Nested
  @DisplayName("POST /api/optimize-with-feedback")
  class OptimizeWithFeedbackTests {

    @Test
    @DisplayName("Should refine the session's prompt")
    void shouldRefinePrompt() throws Exception {
      // Given
      when(promptOptimizationService.optimizeWithFeedback("s-1"))
          .thenReturn(OptimizationResult.success("Refined.", "s-1", 50.0, 60.0));

      // When & Then
      mockMvc
          .perform(
              post("/api/optimize-with-feedback")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"sessionId\":\"s-1\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.result").value("Refined."));
    }

    @Test
    @DisplayName("Should map missing feedback to 400")
    void shouldMapMissingFeedback() throws Exception {
      // Given
      when(promptOptimizationService.optimizeWithFeedback("s-1"))
          .thenReturn(
              OptimizationResult.failure(
                  ErrorKind.NO_FEEDBACK_FOUND, "No feedback", "feedback", "s-1"));

      // When & Then
      mockMvc
          .perform(
              post("/api/optimize-with-feedback")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"sessionId\":\"s-1\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.errorKind").value("NO_FEEDBACK_FOUND"));
    }

    @Test
    @DisplayName("Should map an unknown session to 404")
    void shouldMapUnknownSession() throws Exception {
      // Given
      when(promptOptimizationService.optimizeWithFeedback("gone"))
          .thenReturn(
              OptimizationResult.failure(
                  ErrorKind.SESSION_NOT_FOUND, "Session not found", "session", "gone"));

      // When & Then
      mockMvc
          .perform(
              post("/api/optimize-with-feedback")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"sessionId\":\"gone\"}"))
          .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should require a session id")
    void shouldRequireSessionId() throws Exception {
      mockMvc
          .perform(
              post("/api/optimize-with-feedback")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"sessionId\":\"\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.validationErrors.sessionId").value("sessionId is required"));

      verify(promptOptimizationService, never()).optimizeWithFeedback(any());
    }
  }
}
