package com.promptsmith.optimizer.service.llm;

import org.springframework.stereotype.Service;

import com.promptsmith.optimizer.config.OptimizerProperties;
import com.promptsmith.optimizer.exception.LanguageModelProviderException;
import com.promptsmith.optimizer.exception.LanguageModelTimeoutException;
import com.promptsmith.optimizer.exception.OptimizerException;
import com.promptsmith.optimizer.service.execution.TimeLimitedExecutor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Single entry point for language-model calls. Picks the provider, bounds every call by the
 * configured timeout and normalizes provider failures.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LanguageModelGateway {

  private final LanguageModelSelector selector;
  private final TimeLimitedExecutor timeLimitedExecutor;
  private final OptimizerProperties properties;

  public String complete(String prompt, ModelParameters parameters) {
    LanguageModel provider = selector.select(parameters);
    long started = System.currentTimeMillis();
    try {
      String response =
          timeLimitedExecutor.call(
              () -> provider.complete(prompt, parameters),
              properties.getTimeouts().getLanguageModel(),
              () ->
                  new LanguageModelTimeoutException(
                      parameters.getModel(), properties.getTimeouts().getLanguageModel()));
      log.debug(
          "{} answered in {} ms ({} chars)",
          provider.getProviderName(),
          System.currentTimeMillis() - started,
          response == null ? 0 : response.length());
      return response == null ? "" : response;
    } catch (OptimizerException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new LanguageModelProviderException(
          provider.getProviderName() + " call failed: " + e.getMessage(), e);
    }
  }

  /** Fixes the parameters so downstream code only deals with prompts. */
  public BoundLanguageModel bind(ModelParameters parameters) {
    return new GatewayBoundModel(this, parameters);
  }

  private static final class GatewayBoundModel implements BoundLanguageModel {
    private final LanguageModelGateway gateway;
    private final ModelParameters parameters;

    private GatewayBoundModel(LanguageModelGateway gateway, ModelParameters parameters) {
      this.gateway = gateway;
      this.parameters = parameters;
    }

    @Override
    public String complete(String prompt) {
      return gateway.complete(prompt, parameters);
    }

    @Override
    public BoundLanguageModel withTemperature(double temperature) {
      return new GatewayBoundModel(gateway, parameters.withTemperature(temperature));
    }
  }
}
