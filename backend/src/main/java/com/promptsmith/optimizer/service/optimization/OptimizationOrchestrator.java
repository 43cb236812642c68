package com.promptsmith.optimizer.service.optimization;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.promptsmith.optimizer.config.OptimizerProperties;
import com.promptsmith.optimizer.dto.OptimizationResult;
import com.promptsmith.optimizer.exception.LanguageModelTimeoutException;
import com.promptsmith.optimizer.exception.OperationCancelledException;
import com.promptsmith.optimizer.exception.OptimizerException;
import com.promptsmith.optimizer.exception.TrainerException;
import com.promptsmith.optimizer.service.config.TaskConfig;
import com.promptsmith.optimizer.service.data.DatasetPartition;
import com.promptsmith.optimizer.service.data.SyntheticDataGenerator;
import com.promptsmith.optimizer.service.data.SyntheticExample;
import com.promptsmith.optimizer.service.evaluation.Evaluator;
import com.promptsmith.optimizer.service.evaluation.Metric;
import com.promptsmith.optimizer.service.evaluation.MetricRegistry;
import com.promptsmith.optimizer.service.execution.CancellationToken;
import com.promptsmith.optimizer.service.execution.TimeLimitedExecutor;
import com.promptsmith.optimizer.service.llm.BoundLanguageModel;
import com.promptsmith.optimizer.service.llm.LanguageModelGateway;
import com.promptsmith.optimizer.service.program.Example;
import com.promptsmith.optimizer.service.program.Program;
import com.promptsmith.optimizer.service.program.ProgramFactory;
import com.promptsmith.optimizer.service.signature.SignatureBuilder;
import com.promptsmith.optimizer.service.signature.TaskSignature;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one optimization pass: signature, data, baseline score, compile, optimized score and
 * instruction extraction. Failures never escape; they come back as an error result naming the
 * step that failed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizationOrchestrator {

  private final SignatureBuilder signatureBuilder;
  private final SyntheticDataGenerator syntheticDataGenerator;
  private final ProgramFactory programFactory;
  private final MetricRegistry metricRegistry;
  private final Evaluator evaluator;
  private final Trainer trainer;
  private final LanguageModelGateway languageModelGateway;
  private final TimeLimitedExecutor timeLimitedExecutor;
  private final OptimizerProperties properties;

  public OptimizationResult run(TaskConfig config, CancellationToken cancellationToken) {
    Pass pass = new Pass(config, cancellationToken);
    try {
      return pass.execute();
    } catch (Exception e) {
      OrchestrationState failedIn = pass.state;
      pass.state = OrchestrationState.ERROR;
      log.error(
          "Optimization pass for session {} failed during {}: {}",
          config.getSessionId(),
          failedIn.getNextStage(),
          e.getMessage(),
          e);
      return OptimizationResult.failure(
          OptimizerException.kindOf(e),
          e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
          failedIn.getNextStage(),
          config.getSessionId());
    }
  }

  private final class Pass {
    private final TaskConfig config;
    private final CancellationToken token;
    private OrchestrationState state = OrchestrationState.INIT;

    private Pass(TaskConfig config, CancellationToken token) {
      this.config = config;
      this.token = token;
    }

    private OptimizationResult execute() {
      long started = System.currentTimeMillis();
      log.info(
          "Starting optimization pass: session={} taskType={} module={}",
          config.getSessionId(),
          config.getTaskType(),
          config.getProgramVariant());

      token.throwIfCancelled();
      TaskSignature signature =
          signatureBuilder.build(
              config.signatureName(),
              config.getTask(),
              config.getInputFields(),
              config.getOutputFields());
      advance(OrchestrationState.SIGNATURE_BUILT);

      List<Map<String, String>> trainRecords;
      List<Map<String, String>> validRecords;
      if (config.hasExplicitTrainData()) {
        trainRecords = config.getTrainData();
        validRecords = config.getValidData() != null ? config.getValidData() : List.of();
      } else {
        BoundLanguageModel dataModel = languageModelGateway.bind(config.getDataModelParameters());
        List<SyntheticExample> synthetic =
            syntheticDataGenerator.generate(
                config.getSampleData(),
                config.getSyntheticDataSize(),
                config.getTask(),
                dataModel,
                token);
        DatasetPartition<SyntheticExample> split =
            DatasetPartition.split(synthetic, config.getTrainDataSize());
        trainRecords = valuesOf(split.getTrain());
        validRecords = valuesOf(split.getValidation());
      }
      List<String> inputKeys = signature.inputFieldNames();
      List<Example> trainset = bind(trainRecords, inputKeys);
      List<Example> validset = bind(validRecords, inputKeys);
      List<Example> validsetFull =
          config.isValidDataFullEnabled() ? bind(config.getValidDataFull(), inputKeys) : validset;
      log.info(
          "Data ready: {} train, {} validation, {} scoring examples",
          trainset.size(),
          validset.size(),
          validsetFull.size());
      advance(OrchestrationState.DATA_READY);

      BoundLanguageModel taskModel = languageModelGateway.bind(config.getModelParameters());
      Program program =
          programFactory.create(
              config.getProgramVariant(), signature, config.getTools(), taskModel);
      Metric metric = metricRegistry.metricFor(config.getTaskType(), signature.outputFieldNames());
      double initialScore = evaluator.evaluate(program, validsetFull, metric, token);
      log.info("Baseline score {}", String.format("%.2f", initialScore));
      advance(OrchestrationState.BASELINE_EVALUATED);

      TrainingSpec spec =
          TrainingSpec.builder()
              .program(program)
              .metric(metric)
              .trainset(trainset)
              .valset(validset)
              .settings(config.getTrainerSettings())
              .proposer(taskModel)
              .cancellationToken(token)
              .build();
      Program compiled = compile(spec);
      advance(OrchestrationState.COMPILED);

      double optimizedScore = evaluator.evaluate(compiled, validsetFull, metric, token);
      log.info("Optimized score {}", String.format("%.2f", optimizedScore));
      advance(OrchestrationState.FINAL_EVALUATED);

      String instructions = InstructionExtractor.extract(compiled);
      advance(OrchestrationState.DONE);
      log.info(
          "Optimization pass for session {} finished in {} ms",
          config.getSessionId(),
          System.currentTimeMillis() - started);
      return OptimizationResult.success(
          instructions, config.getSessionId(), initialScore, optimizedScore);
    }

    private Program compile(TrainingSpec spec) {
      Duration timeout = properties.getTimeouts().getTrainer();
      try {
        Program compiled =
            timeLimitedExecutor.call(
                () -> trainer.compile(spec), timeout, () -> TrainerException.timedOut(timeout));
        if (compiled == null) {
          throw new TrainerException("Trainer returned no program", null);
        }
        return compiled;
      } catch (TrainerException
          | OperationCancelledException
          | LanguageModelTimeoutException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new TrainerException("Trainer failed: " + e.getMessage(), e);
      }
    }

    private void advance(OrchestrationState next) {
      token.throwIfCancelled();
      log.debug("Pass {} -> {}", state, next);
      state = next;
    }
  }

  private static List<Map<String, String>> valuesOf(List<SyntheticExample> examples) {
    return examples.stream().map(SyntheticExample::getValues).collect(Collectors.toList());
  }

  private static List<Example> bind(List<Map<String, String>> records, List<String> inputKeys) {
    if (records == null) {
      return List.of();
    }
    return records.stream()
        .map(record -> Example.of(record, inputKeys))
        .collect(Collectors.toList());
  }
}
