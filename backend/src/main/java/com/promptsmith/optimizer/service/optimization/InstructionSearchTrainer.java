package com.promptsmith.optimizer.service.optimization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.promptsmith.optimizer.exception.TrainerException;
import com.promptsmith.optimizer.service.PromptService;
import com.promptsmith.optimizer.service.config.TrainerSettings;
import com.promptsmith.optimizer.service.evaluation.Evaluator;
import com.promptsmith.optimizer.service.execution.CancellationToken;
import com.promptsmith.optimizer.service.llm.BoundLanguageModel;
import com.promptsmith.optimizer.service.program.Example;
import com.promptsmith.optimizer.service.program.Program;
import com.promptsmith.optimizer.service.signature.TaskSignature;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Default trainer. Searches over instruction candidates and demonstration sets:
 *
 * <ol>
 *   <li>bootstraps demonstrations by keeping training examples the current program already solves,
 *       topped up with labelled examples;
 *   <li>asks the proposer model for alternative instructions;
 *   <li>scores random (instruction, demo set) pairs on validation minibatches;
 *   <li>re-scores the best pairs on the whole validation set and keeps the winner.
 * </ol>
 *
 * All random choices come from the configured seed, so a run is repeatable for a deterministic
 * model.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InstructionSearchTrainer implements Trainer {

  static final String PROPOSAL_TEMPLATE = "instruction-proposal";
  static final int FINALISTS = 3;

  private static final List<String> PROPOSAL_TIPS =
      List.of(
          "",
          "Keep the instruction short and direct.",
          "Be descriptive and spell out the expected output format.",
          "Mention edge cases the model should handle.",
          "Give the model a persona suited to the task.",
          "Ask the model to double-check its answer before responding.");

  private final PromptService promptService;
  private final Evaluator evaluator;

  @Override
  public Program compile(TrainingSpec spec) {
    TrainerSettings settings = spec.getSettings();
    CancellationToken token = spec.getCancellationToken();
    Random random = new Random(settings.getSeed());

    TaskSignature signature =
        spec.getProgram()
            .effectiveSignature()
            .orElseThrow(
                () -> new TrainerException("Program has no signature to optimize", null));

    List<Example> valset = spec.getValset().isEmpty() ? spec.getTrainset() : spec.getValset();
    if (valset.isEmpty()) {
      throw new TrainerException("Cannot optimize without training or validation examples", null);
    }

    int numCandidates = Math.max(1, settings.effectiveNumCandidates());
    List<List<Example>> demoSets = buildDemoSets(spec, numCandidates, random, token);
    List<String> instructions =
        proposeInstructions(spec, signature, demoSets, numCandidates, token);
    log.info(
        "Searching {} instructions x {} demo sets over {} trials",
        instructions.size(),
        demoSets.size(),
        settings.effectiveNumTrials());

    Map<Candidate, List<Double>> trialScores = new HashMap<>();
    for (int trial = 0; trial < Math.max(1, settings.effectiveNumTrials()); trial++) {
      token.throwIfCancelled();
      // the first trial always measures the unchanged instruction
      Candidate candidate =
          trial == 0
              ? new Candidate(0, 0)
              : new Candidate(
                  random.nextInt(instructions.size()), random.nextInt(demoSets.size()));
      List<Example> minibatch = sample(valset, settings.getMinibatchSize(), random);
      double score =
          evaluator.evaluate(
              apply(spec.getProgram(), candidate, instructions, demoSets),
              minibatch,
              spec.getMetric(),
              token);
      trialScores.computeIfAbsent(candidate, c -> new ArrayList<>()).add(score);
      log.debug("Trial {} {} scored {}", trial + 1, candidate, String.format("%.2f", score));
    }

    List<Candidate> finalists =
        trialScores.entrySet().stream()
            .sorted(
                Comparator.comparingDouble(
                        (Map.Entry<Candidate, List<Double>> e) -> mean(e.getValue()))
                    .reversed()
                    .thenComparingInt(e -> e.getKey().getInstructionIndex())
                    .thenComparingInt(e -> e.getKey().getDemoSetIndex()))
            .limit(FINALISTS)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());

    Program best = null;
    double bestScore = -1;
    for (Candidate finalist : finalists) {
      token.throwIfCancelled();
      Program program = apply(spec.getProgram(), finalist, instructions, demoSets);
      double score = evaluator.evaluate(program, valset, spec.getMetric(), token);
      log.info(
          "Finalist {} scored {} on {} examples",
          finalist,
          String.format("%.2f", score),
          valset.size());
      if (score > bestScore) {
        best = program;
        bestScore = score;
      }
    }
    return best;
  }

  private List<List<Example>> buildDemoSets(
      TrainingSpec spec, int count, Random random, CancellationToken token) {
    TrainerSettings settings = spec.getSettings();
    List<Example> shuffled = new ArrayList<>(spec.getTrainset());
    Collections.shuffle(shuffled, random);

    List<Example> bootstrapped = new ArrayList<>();
    List<Example> unsolved = new ArrayList<>();
    for (Example example : shuffled) {
      if (bootstrapped.size() >= settings.getMaxBootstrappedDemos()) {
        unsolved.add(example);
        continue;
      }
      token.throwIfCancelled();
      double score =
          spec.getMetric().score(example, spec.getProgram().forward(example.inputs()));
      if (score >= 1.0) {
        bootstrapped.add(example);
      } else {
        unsolved.add(example);
      }
    }
    log.info(
        "Bootstrapped {} demonstrations from {} examples", bootstrapped.size(), shuffled.size());

    List<List<Example>> demoSets = new ArrayList<>();
    // set 0 keeps the program's current demos so the unchanged program is always a candidate
    demoSets.add(spec.getProgram().demos());
    for (int i = 1; i < count; i++) {
      List<Example> labelled = new ArrayList<>(unsolved);
      Collections.shuffle(labelled, random);
      List<Example> demos = new ArrayList<>(bootstrapped);
      Collections.shuffle(demos, random);
      labelled.stream().limit(settings.getMaxLabeledDemos()).forEach(demos::add);
      demoSets.add(List.copyOf(demos));
    }
    return demoSets;
  }

  private List<String> proposeInstructions(
      TrainingSpec spec,
      TaskSignature signature,
      List<List<Example>> demoSets,
      int count,
      CancellationToken token) {
    Set<String> instructions = new LinkedHashSet<>();
    instructions.add(signature.getInstructions());
    BoundLanguageModel proposer =
        spec.getProposer().withTemperature(spec.getSettings().getInitTemperature());

    for (int i = 1; i < count; i++) {
      token.throwIfCancelled();
      List<Example> demos = demoSets.get(i % demoSets.size());
      Map<String, String> values = new HashMap<>();
      values.put("INSTRUCTIONS", signature.getInstructions());
      values.put("INPUT_KEYS", String.join(", ", signature.inputFieldNames()));
      values.put("OUTPUT_KEYS", String.join(", ", signature.outputFieldNames()));
      values.put("DEMOS", formatDemos(demos));
      values.put("TIP", PROPOSAL_TIPS.get(i % PROPOSAL_TIPS.size()));
      String proposal = proposer.complete(promptService.render(PROPOSAL_TEMPLATE, values)).trim();
      if (proposal.isEmpty()) {
        log.debug("Proposal {} came back empty", i);
        continue;
      }
      instructions.add(proposal);
    }
    return new ArrayList<>(instructions);
  }

  private static String formatDemos(List<Example> demos) {
    return demos.stream()
        .limit(3)
        .map(
            demo ->
                demo.getValues().entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining("\n")))
        .collect(Collectors.joining("\n\n"));
  }

  private static Program apply(
      Program program, Candidate candidate, List<String> instructions, List<List<Example>> demos) {
    return program
        .withInstructions(instructions.get(candidate.getInstructionIndex()))
        .withDemos(demos.get(candidate.getDemoSetIndex()));
  }

  private static List<Example> sample(List<Example> examples, int size, Random random) {
    if (examples.size() <= size) {
      return examples;
    }
    List<Example> copy = new ArrayList<>(examples);
    Collections.shuffle(copy, random);
    return copy.subList(0, size);
  }

  private static double mean(List<Double> scores) {
    return scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
  }

  @Value
  private static class Candidate {
    int instructionIndex;
    int demoSetIndex;
  }
}
