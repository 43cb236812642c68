package com.promptsmith.optimizer.service.llm;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.promptsmith.optimizer.exception.LanguageModelProviderException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the provider for a call. The call's own provider wins, then the configured preferred
 * provider, then any provider that is configured.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LanguageModelSelector {

  private final List<LanguageModel> providers;

  @Value("${llm.provider:openai}")
  private String preferredProvider;

  public LanguageModel select(ModelParameters parameters) {
    String requested =
        parameters.getProvider() != null && !parameters.getProvider().isBlank()
            ? parameters.getProvider()
            : preferredProvider;

    for (LanguageModel provider : providers) {
      if (provider.getProviderName().equalsIgnoreCase(requested)
          && provider.isConfigured(parameters)) {
        log.debug("Using {} provider for LLM calls", provider.getProviderName());
        return provider;
      }
    }

    for (LanguageModel provider : providers) {
      if (provider.isConfigured(parameters)) {
        log.debug(
            "Provider '{}' not available, falling back to {}",
            requested,
            provider.getProviderName());
        return provider;
      }
    }

    throw new LanguageModelProviderException(
        "No language model provider is configured. Configure an OpenAI API key or AWS Bedrock"
            + " credentials.");
  }
}
