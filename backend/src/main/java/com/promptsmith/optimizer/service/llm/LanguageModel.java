package com.promptsmith.optimizer.service.llm;

/**
 * Common interface for language-model providers (OpenAI-compatible endpoints, AWS Bedrock, ...).
 */
public interface LanguageModel {

  /**
   * Sends a single-turn prompt and returns the model's text answer.
   *
   * @param prompt the full prompt text
   * @param parameters model, credentials and sampling settings for this call; unset values fall
   *     back to the provider's configured defaults
   * @return the response text
   * @throws com.promptsmith.optimizer.exception.LanguageModelProviderException if the provider
   *     rejects or fails the call
   */
  String complete(String prompt, ModelParameters parameters);

  /** Provider key used for selection ("openai", "bedrock"). */
  String getProviderName();

  /**
   * Checks if the provider can serve calls with the given parameters
   *
   * @return true if configured, false otherwise
   */
  boolean isConfigured(ModelParameters parameters);
}
