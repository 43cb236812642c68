package com.promptsmith.optimizer.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

  private int syntheticDataSize = 30;
  private double trainRatio = 0.2;
  private String taskType = "other";
  private String programVariant = "predict";

  private Synthetic synthetic = new Synthetic();
  private Trainer trainer = new Trainer();
  private Model model = new Model();
  private Timeouts timeouts = new Timeouts();
  private Executor executor = new Executor();

  @Data
  public static class Synthetic {
    private int tokenBudget = 8000;
    private int maxBatchSize = 50;
    private int charsPerToken = 4;
  }

  @Data
  public static class Trainer {
    /** light, medium or heavy; overrides candidate and trial counts when set. */
    private String auto;

    private int numCandidates = 5;
    private double initTemperature = 0.7;
    private int maxBootstrappedDemos = 3;
    private int maxLabeledDemos = 4;
    private int numTrials = 10;
    private int minibatchSize = 8;
    private long seed = 9L;
  }

  @Data
  public static class Model {
    private String provider = "openai";
    private String name = "gpt-4o-mini";
    private String apiBase;
    private double temperature = 0.7;
    private int maxTokens = 4096;
  }

  @Data
  public static class Timeouts {
    private Duration languageModel = Duration.ofSeconds(120);
    private Duration trainer = Duration.ofMinutes(30);
  }

  @Data
  public static class Executor {
    private int corePoolSize = 4;
    private int maxPoolSize = 16;
    private int queueCapacity = 100;
  }
}
