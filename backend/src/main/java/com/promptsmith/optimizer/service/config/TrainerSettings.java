package com.promptsmith.optimizer.service.config;

import java.util.Locale;

import lombok.Builder;
import lombok.Value;

/** Hyperparameters handed to the trainer. */
@Value
@Builder(toBuilder = true)
public class TrainerSettings {

  /** light, medium or heavy preset; null keeps the explicit counts. */
  String auto;

  int numCandidates;
  double initTemperature;
  int maxBootstrappedDemos;
  int maxLabeledDemos;
  int numTrials;
  int minibatchSize;
  long seed;

  public int effectiveNumCandidates() {
    switch (preset()) {
      case "light":
        return 3;
      case "medium":
        return 6;
      case "heavy":
        return 9;
      default:
        return numCandidates;
    }
  }

  public int effectiveNumTrials() {
    switch (preset()) {
      case "light":
        return 6;
      case "medium":
        return 12;
      case "heavy":
        return 18;
      default:
        return numTrials;
    }
  }

  private String preset() {
    return auto == null ? "" : auto.trim().toLowerCase(Locale.ROOT);
  }
}
