package com.promptsmith.optimizer.service.program;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.promptsmith.optimizer.service.signature.TaskSignature;

/**
 * A prompt program built around a {@link TaskSignature}. Programs are immutable: the {@code with*}
 * methods return configured copies, which is how a trainer produces its optimized program.
 */
public interface Program {

  Prediction forward(Map<String, String> inputs);

  /** The signature this program owns directly, if any. */
  Optional<TaskSignature> signature();

  /** The nested predictor that wraps the signature for composite programs. */
  Optional<Program> predictor();

  List<Example> demos();

  Program withInstructions(String instructions);

  Program withDemos(List<Example> demos);

  /** Signature reachable from this program, looking through a nested predictor if needed. */
  default Optional<TaskSignature> effectiveSignature() {
    Optional<TaskSignature> own = signature();
    if (own.isPresent()) {
      return own;
    }
    return predictor().flatMap(Program::signature);
  }
}
