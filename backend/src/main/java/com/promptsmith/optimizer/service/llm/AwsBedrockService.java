package com.promptsmith.optimizer.service.llm;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.promptsmith.optimizer.exception.LanguageModelProviderException;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.AccessDeniedException;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;
import software.amazon.awssdk.services.bedrockruntime.model.ValidationException;

/**
 * Calls AWS Bedrock through the unified Converse API, so any Bedrock chat model id can be used
 * without model-specific request bodies.
 */
@Slf4j
@Service
public class AwsBedrockService implements LanguageModel {

  private volatile BedrockRuntimeClient bedrockRuntimeClient;

  @Value("${aws.bedrock.model-id:anthropic.claude-3-5-sonnet-20240620-v1:0}")
  private String defaultModelId;

  @Value("${aws.bedrock.enabled:false}")
  private boolean enabled;

  @Value("${aws.region:us-east-1}")
  private String awsRegion;

  @Value("${aws.access-key-id:}")
  private String accessKeyId;

  @Value("${aws.secret-access-key:}")
  private String secretAccessKey;

  @Value("${aws.bedrock.retry.max-attempts:5}")
  private int maxRetryAttempts;

  @Value("${aws.bedrock.retry.initial-delay-ms:1000}")
  private long initialRetryDelayMs;

  @Value("${aws.bedrock.retry.max-delay-ms:60000}")
  private long maxRetryDelayMs;

  @Value("${aws.bedrock.retry.jitter-ms:1000}")
  private long retryJitterMs;

  @Override
  public String getProviderName() {
    return "bedrock";
  }

  @Override
  public boolean isConfigured(ModelParameters parameters) {
    return enabled || (!accessKeyId.isEmpty() && !secretAccessKey.isEmpty());
  }

  @Override
  public String complete(String prompt, ModelParameters parameters) {
    String modelId =
        parameters.getModel() != null && !parameters.getModel().isBlank()
            ? parameters.getModel()
            : defaultModelId;

    log.debug("Sending prompt to AWS Bedrock model {}:\n{}", modelId, prompt);

    ContentBlock contentBlock = ContentBlock.builder().text(prompt).build();
    Message userMessage =
        Message.builder().role(ConversationRole.USER).content(contentBlock).build();

    InferenceConfiguration.Builder inferenceConfig = InferenceConfiguration.builder();
    if (parameters.getMaxTokens() != null) {
      inferenceConfig.maxTokens(parameters.getMaxTokens());
    }
    if (parameters.getTemperature() != null) {
      inferenceConfig.temperature(parameters.getTemperature().floatValue());
    }

    ConverseRequest converseRequest =
        ConverseRequest.builder()
            .modelId(modelId)
            .messages(List.of(userMessage))
            .inferenceConfig(inferenceConfig.build())
            .build();

    int attempt = 0;
    long retryDelay = initialRetryDelayMs;

    while (true) {
      try {
        ConverseResponse response = client().converse(converseRequest);

        Message responseMessage = response.output().message();
        if (responseMessage != null && !responseMessage.content().isEmpty()) {
          ContentBlock responseContent = responseMessage.content().get(0);
          if (responseContent.text() != null) {
            return responseContent.text();
          }
        }
        throw new LanguageModelProviderException("No content in Bedrock model response");

      } catch (ThrottlingException e) {
        attempt++;
        if (attempt >= maxRetryAttempts) {
          log.error("Max retry attempts ({}) reached for AWS Bedrock throttling", maxRetryAttempts);
          throw new LanguageModelProviderException(
              String.format(
                  "AWS Bedrock throttling error after %d retry attempts", maxRetryAttempts),
              e);
        }

        log.warn(
            "AWS Bedrock throttling detected. Retrying in {} ms (attempt {}/{})",
            retryDelay,
            attempt,
            maxRetryAttempts);

        try {
          Thread.sleep(retryDelay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new LanguageModelProviderException("Retry interrupted", ie);
        }

        retryDelay =
            Math.min(retryDelay * 2 + (long) (Math.random() * retryJitterMs), maxRetryDelayMs);

      } catch (AccessDeniedException e) {
        log.error("Access denied to AWS Bedrock model: {}", modelId, e);
        throw new LanguageModelProviderException(
            String.format(
                "You don't have access to the model '%s' in region %s", modelId, awsRegion),
            e);
      } catch (ValidationException e) {
        log.error("Validation error for model: {}", modelId, e);
        throw new LanguageModelProviderException(
            String.format("Model '%s' rejected the request: %s", modelId, e.getMessage()), e);
      } catch (LanguageModelProviderException e) {
        throw e;
      } catch (Exception e) {
        log.error("Error invoking model: {}", modelId, e);
        throw new LanguageModelProviderException(
            "Failed to invoke Bedrock model: " + e.getMessage(), e);
      }
    }
  }

  private BedrockRuntimeClient client() {
    BedrockRuntimeClient current = bedrockRuntimeClient;
    if (current == null) {
      synchronized (this) {
        if (bedrockRuntimeClient == null) {
          bedrockRuntimeClient =
              BedrockRuntimeClient.builder()
                  .region(Region.of(awsRegion))
                  .credentialsProvider(credentialsProvider())
                  .build();
          log.info("AWS Bedrock client initialized for region: {}", awsRegion);
        }
        current = bedrockRuntimeClient;
      }
    }
    return current;
  }

  private AwsCredentialsProvider credentialsProvider() {
    if (!accessKeyId.isEmpty() && !secretAccessKey.isEmpty()) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    }
    return DefaultCredentialsProvider.create();
  }

  @PreDestroy
  public void close() {
    if (bedrockRuntimeClient != null) {
      bedrockRuntimeClient.close();
      bedrockRuntimeClient = null;
    }
  }
}
