package com.promptsmith.optimizer.UnitTests.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptsmith.optimizer.controller.FeedbackController;
import com.promptsmith.optimizer.dto.FeedbackRequest;
import com.promptsmith.optimizer.exception.ConfigException;
import com.promptsmith.optimizer.service.PromptOptimizationService;
import com.promptsmith.optimizer.service.feedback.Feedback;
import com.promptsmith.optimizer.service.feedback.FeedbackAnalysis;
import com.promptsmith.optimizer.service.feedback.FeedbackStore;

@WebMvcTest(FeedbackController.class)
@DisplayName("FeedbackController Tests")
class FeedbackControllerTest {

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @MockBean private PromptOptimizationService promptOptimizationService;

  @MockBean private FeedbackStore feedbackStore;

  private static Feedback feedback(String id, String comment) {
    return Feedback.builder()
        .id(id)
        .text("Classify the review")
        .startOffset(0)
        .endOffset(8)
        .feedback(comment)
        .promptId("s-1")
        .createdAt(Instant.parse("2026-01-01T12:00:00Z"))
        .build();
  }

  private static FeedbackRequest request() {
    FeedbackRequest request = new FeedbackRequest();
    request.setText("Classify the review");
    request.setStartOffset(0);
    request.setEndOffset(8);
    request.setFeedback("say which labels are allowed");
    request.setPromptId("s-1");
    return request;
  }

  @Nested
  @DisplayName("POST /api/comments")
  class AddFeedbackTests {

    @Test
    @DisplayName("Should store feedback and return it with 201")
    void shouldStoreFeedback() throws Exception {
      // Given
      when(promptOptimizationService.addFeedback(
              "Classify the review", 0, 8, "say which labels are allowed", "s-1"))
          .thenReturn(feedback("f-1", "say which labels are allowed"));

      // When & Then
      mockMvc
          .perform(
              post("/api/comments")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request())))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.id").value("f-1"))
          .andExpect(jsonPath("$.promptId").value("s-1"))
          .andExpect(jsonPath("$.endOffset").value(8));
    }

    @Test
    @DisplayName("Should reject offsets outside the text")
    void shouldRejectBadOffsets() throws Exception {
      // Given
      FeedbackRequest request = request();
      request.setEndOffset(200);
      when(promptOptimizationService.addFeedback(anyString(), anyInt(), eq(200), any(), any()))
          .thenThrow(new ConfigException("Offsets must satisfy 0 <= startOffset <= endOffset"));

      // When & Then
      mockMvc
          .perform(
              post("/api/comments")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.errorKind").value("CONFIG"));
    }

    @Test
    @DisplayName("Should report every missing field")
    void shouldValidateFields() throws Exception {
      mockMvc
          .perform(post("/api/comments").contentType(MediaType.APPLICATION_JSON).content("{}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.validationErrors.text").value("text is required"))
          .andExpect(jsonPath("$.validationErrors.promptId").value("promptId is required"))
          .andExpect(jsonPath("$.validationErrors.startOffset").exists());

      verify(promptOptimizationService, never())
          .addFeedback(any(), anyInt(), anyInt(), any(), any());
    }
  }

  @Nested
  @DisplayName("GET /api/comments")
  class ListFeedbackTests {

    @Test
    @DisplayName("Should list all feedback")
    void shouldListFeedback() throws Exception {
      // Given
      when(promptOptimizationService.getAllFeedback())
          .thenReturn(List.of(feedback("f-1", "a"), feedback("f-2", "b")));

      // When & Then
      mockMvc
          .perform(get("/api/comments"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.length()").value(2))
          .andExpect(jsonPath("$[1].feedback").value("b"));
    }

    @Test
    @DisplayName("Should analyze feedback for one session")
    void shouldAnalyzeFeedback() throws Exception {
      // Given
      when(feedbackStore.analyze("s-1"))
          .thenReturn(
              FeedbackAnalysis.builder()
                  .totalFeedback(2)
                  .feedbackPerSession(Map.of("s-1", 2))
                  .latest(feedback("f-2", "b"))
                  .build());

      // When & Then
      mockMvc
          .perform(get("/api/comments/analysis").param("promptId", "s-1"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.totalFeedback").value(2))
          .andExpect(jsonPath("$.feedbackPerSession['s-1']").value(2))
          .andExpect(jsonPath("$.latest.id").value("f-2"));
    }
  }

  @Nested
  @DisplayName("CORS and HTTP Methods")
  class CorsAndHttpMethods {

    @Test
    @DisplayName("Should support CORS preflight")
    void shouldSupportCorsPreflight() throws Exception {
      mockMvc
          .perform(
              options("/api/comments")
                  .header("Origin", "http://localhost:4200")
                  .header("Access-Control-Request-Method", "POST"))
          .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Should not support DELETE")
    void shouldNotSupportDelete() throws Exception {
      mockMvc.perform(delete("/api/comments")).andExpect(status().isMethodNotAllowed());
    }
  }
}
