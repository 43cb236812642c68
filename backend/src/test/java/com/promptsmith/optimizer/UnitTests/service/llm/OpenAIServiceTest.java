package com.promptsmith.optimizer.service.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptsmith.optimizer.exception.LanguageModelProviderException;

@ExtendWith(MockitoExtension.class)
@DisplayName("OpenAIService Tests")
class OpenAIServiceTest {

  private static final String COMPLETION =
      "{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"positive\"}}]}";

  @Mock private RestTemplate restTemplate;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private OpenAIService service;

  @BeforeEach
  void setUp() {
    service = new OpenAIService(objectMapper, restTemplate);
    ReflectionTestUtils.setField(service, "openaiApiKey", "sk-test");
    ReflectionTestUtils.setField(service, "defaultApiBase", OpenAIService.DEFAULT_API_BASE);
    ReflectionTestUtils.setField(service, "maxRetryAttempts", 2);
    ReflectionTestUtils.setField(service, "initialRetryDelayMs", 0L);
  }

  private static ModelParameters params() {
    return ModelParameters.builder().model("gpt-4o-mini").temperature(0.2).maxTokens(256).build();
  }

  @Test
  @DisplayName("Should post a chat completion and return the message content")
  @SuppressWarnings("unchecked")
  void shouldCompletePrompt() throws Exception {
    when(restTemplate.exchange(
            eq("https://api.openai.com/v1/chat/completions"),
            eq(HttpMethod.POST),
            any(HttpEntity.class),
            eq(String.class)))
        .thenReturn(ResponseEntity.ok(COMPLETION));

    String answer = service.complete("Classify: great", params());

    assertThat(answer).isEqualTo("positive");
    ArgumentCaptor<HttpEntity<String>> captor = ArgumentCaptor.forClass(HttpEntity.class);
    verify(restTemplate)
        .exchange(anyString(), eq(HttpMethod.POST), captor.capture(), eq(String.class));
    JsonNode body = objectMapper.readTree(captor.getValue().getBody());
    assertThat(body.get("model").asText()).isEqualTo("gpt-4o-mini");
    assertThat(body.get("max_tokens").asInt()).isEqualTo(256);
    assertThat(body.get("messages").get(0).get("content").asText()).isEqualTo("Classify: great");
    assertThat(captor.getValue().getHeaders().getFirst(HttpHeaders.AUTHORIZATION))
        .isEqualTo("Bearer sk-test");
  }

  @Test
  @DisplayName("Should call a custom endpoint without an api key")
  void shouldUseCustomEndpoint() {
    ReflectionTestUtils.setField(service, "openaiApiKey", "");
    ModelParameters custom = params().toBuilder().apiBase("http://localhost:8000/v1/").build();
    when(restTemplate.exchange(
            eq("http://localhost:8000/v1/chat/completions"),
            eq(HttpMethod.POST),
            any(HttpEntity.class),
            eq(String.class)))
        .thenReturn(ResponseEntity.ok(COMPLETION));

    assertThat(service.isConfigured(custom)).isTrue();
    assertThat(service.complete("hi", custom)).isEqualTo("positive");
  }

  @Test
  @DisplayName("Should refuse calls without credentials")
  void shouldRefuseWithoutKey() {
    ReflectionTestUtils.setField(service, "openaiApiKey", "");

    assertThatThrownBy(() -> service.complete("hi", params()))
        .isInstanceOf(LanguageModelProviderException.class)
        .hasMessageContaining("API key not configured");
    verifyNoInteractions(restTemplate);
  }

  @Nested
  @DisplayName("Retry Policy")
  class RetryPolicyTests {

    @Test
    @DisplayName("Should retry server errors up to the configured attempts")
    void shouldRetryServerErrors() {
      // Given
      when(restTemplate.exchange(
              anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
          .thenThrow(status(HttpStatus.SERVICE_UNAVAILABLE));

      // When / Then
      assertThatThrownBy(() -> service.complete("hi", params()))
          .isInstanceOf(LanguageModelProviderException.class)
          .hasMessageContaining("after 2 attempts");
      verify(restTemplate, times(2))
          .exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class));
    }

    @Test
    @DisplayName("Should retry a rate-limited call and return the next answer")
    void shouldRetryRateLimit() {
      // Given
      when(restTemplate.exchange(
              anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
          .thenThrow(status(HttpStatus.TOO_MANY_REQUESTS))
          .thenReturn(ResponseEntity.ok(COMPLETION));

      // When
      String answer = service.complete("hi", params());

      // Then
      assertThat(answer).isEqualTo("positive");
      verify(restTemplate, times(2))
          .exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class));
    }

    @Test
    @DisplayName("Should fail on the first rejected request")
    void shouldFailFastOnClientError() {
      // Given
      when(restTemplate.exchange(
              anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
          .thenThrow(status(HttpStatus.UNAUTHORIZED));

      // When / Then
      assertThatThrownBy(() -> service.complete("hi", params()))
          .isInstanceOf(LanguageModelProviderException.class)
          .hasMessageContaining("rejected the request")
          .hasCauseInstanceOf(HttpClientErrorException.class);
      verify(restTemplate, times(1))
          .exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class));
    }

    @Test
    @DisplayName("Should not retry transport failures")
    void shouldNotRetryTransportFailures() {
      when(restTemplate.exchange(
              anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
          .thenThrow(new ResourceAccessException("connection reset"));

      assertThatThrownBy(() -> service.complete("hi", params()))
          .isInstanceOf(LanguageModelProviderException.class)
          .hasMessageContaining("connection reset");
      verify(restTemplate, times(1))
          .exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class));
    }

    private RestClientResponseException status(HttpStatus status) {
      return status.is5xxServerError()
          ? HttpServerErrorException.create(
              status, status.getReasonPhrase(), HttpHeaders.EMPTY, new byte[0], null)
          : HttpClientErrorException.create(
              status, status.getReasonPhrase(), HttpHeaders.EMPTY, new byte[0], null);
    }
  }

  @Test
  @DisplayName("Should not retry a malformed response")
  void shouldNotRetryMalformedResponse() {
    when(restTemplate.exchange(
            anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
        .thenReturn(ResponseEntity.ok("{\"choices\": []}"));

    assertThatThrownBy(() -> service.complete("hi", params()))
        .isInstanceOf(LanguageModelProviderException.class)
        .hasMessageContaining("Invalid response format");
    verify(restTemplate, times(1))
        .exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class));
  }
}
