package com.promptsmith.optimizer.service.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.promptsmith.optimizer.exception.LanguageModelProviderException;

import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.AccessDeniedException;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseOutput;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;

@ExtendWith(MockitoExtension.class)
@DisplayName("AwsBedrockService Tests")
class AwsBedrockServiceTest {

  @Mock private BedrockRuntimeClient client;

  private AwsBedrockService service;

  @BeforeEach
  void setUp() {
    service = new AwsBedrockService();
    ReflectionTestUtils.setField(service, "bedrockRuntimeClient", client);
    ReflectionTestUtils.setField(service, "defaultModelId", "anthropic.claude-test");
    ReflectionTestUtils.setField(service, "enabled", false);
    ReflectionTestUtils.setField(service, "awsRegion", "us-east-1");
    ReflectionTestUtils.setField(service, "accessKeyId", "");
    ReflectionTestUtils.setField(service, "secretAccessKey", "");
    ReflectionTestUtils.setField(service, "maxRetryAttempts", 2);
    ReflectionTestUtils.setField(service, "initialRetryDelayMs", 0L);
    ReflectionTestUtils.setField(service, "maxRetryDelayMs", 0L);
    ReflectionTestUtils.setField(service, "retryJitterMs", 0L);
  }

  private static ConverseResponse answer(String text) {
    Message message =
        Message.builder()
            .role(ConversationRole.ASSISTANT)
            .content(ContentBlock.fromText(text))
            .build();
    return ConverseResponse.builder().output(ConverseOutput.fromMessage(message)).build();
  }

  @Nested
  @DisplayName("Availability")
  class AvailabilityTests {

    @Test
    @DisplayName("Should not be configured without credentials or the enabled flag")
    void shouldNotBeConfigured() {
      assertThat(service.getProviderName()).isEqualTo("bedrock");
      assertThat(service.isConfigured(ModelParameters.builder().build())).isFalse();
    }

    @Test
    @DisplayName("Should be configured with static credentials")
    void shouldBeConfiguredWithKeys() {
      ReflectionTestUtils.setField(service, "accessKeyId", "AKIA");
      ReflectionTestUtils.setField(service, "secretAccessKey", "secret");

      assertThat(service.isConfigured(ModelParameters.builder().build())).isTrue();
    }
  }

  @Nested
  @DisplayName("Converse calls")
  class ConverseTests {

    @Test
    @DisplayName("Should send the prompt with the requested model and sampling settings")
    void shouldSendPrompt() {
      // Given
      when(client.converse(any(ConverseRequest.class))).thenReturn(answer("Label each review."));
      ModelParameters parameters =
          ModelParameters.builder()
              .model("meta.llama-test")
              .temperature(0.2)
              .maxTokens(256)
              .build();

      // When
      String text = service.complete("Improve this prompt", parameters);

      // Then
      assertThat(text).isEqualTo("Label each review.");
      ArgumentCaptor<ConverseRequest> request = ArgumentCaptor.forClass(ConverseRequest.class);
      verify(client).converse(request.capture());
      assertThat(request.getValue().modelId()).isEqualTo("meta.llama-test");
      assertThat(request.getValue().inferenceConfig().maxTokens()).isEqualTo(256);
      assertThat(request.getValue().messages().get(0).content().get(0).text())
          .isEqualTo("Improve this prompt");
    }

    @Test
    @DisplayName("Should fall back to the default model")
    void shouldUseDefaultModel() {
      when(client.converse(any(ConverseRequest.class))).thenReturn(answer("ok"));

      service.complete("p", ModelParameters.builder().build());

      ArgumentCaptor<ConverseRequest> request = ArgumentCaptor.forClass(ConverseRequest.class);
      verify(client).converse(request.capture());
      assertThat(request.getValue().modelId()).isEqualTo("anthropic.claude-test");
    }

    @Test
    @DisplayName("Should retry throttled calls")
    void shouldRetryThrottling() {
      when(client.converse(any(ConverseRequest.class)))
          .thenThrow(ThrottlingException.builder().message("slow down").build())
          .thenReturn(answer("ok"));

      assertThat(service.complete("p", ModelParameters.builder().build())).isEqualTo("ok");
      verify(client, times(2)).converse(any(ConverseRequest.class));
    }

    @Test
    @DisplayName("Should give up after the last throttled attempt")
    void shouldGiveUpAfterRetries() {
      when(client.converse(any(ConverseRequest.class)))
          .thenThrow(ThrottlingException.builder().message("slow down").build());

      assertThatThrownBy(() -> service.complete("p", ModelParameters.builder().build()))
          .isInstanceOf(LanguageModelProviderException.class)
          .hasMessageContaining("throttling");
      verify(client, times(2)).converse(any(ConverseRequest.class));
    }

    @Test
    @DisplayName("Should report missing model access without retrying")
    void shouldReportAccessDenied() {
      when(client.converse(any(ConverseRequest.class)))
          .thenThrow(AccessDeniedException.builder().message("denied").build());

      assertThatThrownBy(() -> service.complete("p", ModelParameters.builder().build()))
          .isInstanceOf(LanguageModelProviderException.class)
          .hasMessageContaining("anthropic.claude-test")
          .hasMessageContaining("us-east-1");
      verify(client, times(1)).converse(any(ConverseRequest.class));
    }
  }
}
