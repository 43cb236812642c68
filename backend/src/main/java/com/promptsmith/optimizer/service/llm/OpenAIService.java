package com.promptsmith.optimizer.service.llm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.promptsmith.optimizer.exception.LanguageModelProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat-completions client for OpenAI and OpenAI-compatible endpoints. The endpoint is taken from
 * the call's {@code apiBase} when present, so self-hosted gateways work with the same code.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAIService implements LanguageModel {

  static final String DEFAULT_API_BASE = "https://api.openai.com/v1";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;

  @Value("${openai.api-key:}")
  private String openaiApiKey;

  @Value("${openai.api-base:" + DEFAULT_API_BASE + "}")
  private String defaultApiBase;

  @Value("${openai.retry.max-attempts:3}")
  private int maxRetryAttempts;

  @Value("${openai.retry.initial-delay-ms:1000}")
  private long initialRetryDelayMs;

  @Override
  public String getProviderName() {
    return "openai";
  }

  @Override
  public boolean isConfigured(ModelParameters parameters) {
    return hasText(resolveApiKey(parameters)) || isCustomEndpoint(parameters);
  }

  @Override
  public String complete(String prompt, ModelParameters parameters) {
    if (!isConfigured(parameters)) {
      throw new LanguageModelProviderException(
          "OpenAI API key not configured. Please set OPENAI_API_KEY or pass an api key.");
    }

    String url = stripTrailingSlash(resolveApiBase(parameters)) + "/chat/completions";
    log.info(
        "OpenAI request model={}, maxTokens={}, temperature={}",
        parameters.getModel(),
        parameters.getMaxTokens(),
        parameters.getTemperature());
    log.debug(
        "OpenAI prompt (first 500 chars): {}",
        prompt != null && prompt.length() > 500 ? prompt.substring(0, 500) + "…" : prompt);

    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.put("model", parameters.getModel());
    if (parameters.getMaxTokens() != null) {
      requestBody.put("max_tokens", parameters.getMaxTokens());
    }
    if (parameters.getTemperature() != null) {
      requestBody.put("temperature", parameters.getTemperature());
    }

    var messages = objectMapper.createArrayNode();
    var message = objectMapper.createObjectNode();
    message.put("role", "user");
    message.put("content", prompt);
    messages.add(message);
    requestBody.set("messages", messages);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    String apiKey = resolveApiKey(parameters);
    if (hasText(apiKey)) {
      headers.setBearerAuth(apiKey);
    }

    HttpEntity<String> entity = new HttpEntity<>(requestBody.toString(), headers);

    int attempt = 0;
    while (true) {
      try {
        ResponseEntity<String> response =
            restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
        return extractContent(response);
      } catch (LanguageModelProviderException e) {
        throw e;
      } catch (HttpServerErrorException | HttpClientErrorException.TooManyRequests e) {
        attempt++;
        log.warn(
            "OpenAI API call attempt {} failed with {}: {}",
            attempt,
            e.getStatusCode(),
            e.getMessage());

        if (attempt >= maxRetryAttempts) {
          throw new LanguageModelProviderException(
              "OpenAI API call failed after " + maxRetryAttempts + " attempts: " + e.getMessage(),
              e);
        }

        try {
          Thread.sleep(initialRetryDelayMs * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new LanguageModelProviderException("Interrupted during retry", ie);
        }
      } catch (HttpClientErrorException e) {
        // a rejected request fails the same way on every attempt
        log.error("OpenAI API rejected the request with {}", e.getStatusCode());
        throw new LanguageModelProviderException(
            "OpenAI API rejected the request: " + e.getStatusCode(), e);
      } catch (Exception e) {
        throw new LanguageModelProviderException("OpenAI API call failed: " + e.getMessage(), e);
      }
    }
  }

  private String extractContent(ResponseEntity<String> response) throws Exception {
    if (response.getBody() != null) {
      JsonNode responseJson = objectMapper.readTree(response.getBody());
      JsonNode choices = responseJson.get("choices");

      if (choices != null && choices.isArray() && choices.size() > 0) {
        JsonNode messageNode = choices.get(0).get("message");
        if (messageNode != null && messageNode.has("content")) {
          String content = messageNode.get("content").asText();
          log.info("OpenAI response content length={} chars", content.length());
          return content;
        }
      }
    }

    log.error(
        "Invalid response format from OpenAI API: status={}, bodyPresent={}",
        response.getStatusCode(),
        response.getBody() != null);
    throw new LanguageModelProviderException("Invalid response format from OpenAI API");
  }

  private String resolveApiKey(ModelParameters parameters) {
    return hasText(parameters.getApiKey()) ? parameters.getApiKey() : openaiApiKey;
  }

  private String resolveApiBase(ModelParameters parameters) {
    return hasText(parameters.getApiBase()) ? parameters.getApiBase() : defaultApiBase;
  }

  private boolean isCustomEndpoint(ModelParameters parameters) {
    return hasText(parameters.getApiBase())
        && !stripTrailingSlash(parameters.getApiBase()).equals(DEFAULT_API_BASE);
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  private static boolean hasText(String value) {
    return value != null && !value.trim().isEmpty();
  }
}
