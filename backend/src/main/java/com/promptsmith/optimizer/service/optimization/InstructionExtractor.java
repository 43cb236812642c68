package com.promptsmith.optimizer.service.optimization;

import com.promptsmith.optimizer.exception.ErrorKind;
import com.promptsmith.optimizer.exception.OptimizerException;
import com.promptsmith.optimizer.service.program.Program;
import com.promptsmith.optimizer.service.signature.TaskSignature;

/** Reads the instruction text out of a compiled program. */
public final class InstructionExtractor {

  private InstructionExtractor() {}

  /**
   * Uses the program's own signature, falling back to its nested predictor's signature.
   *
   * @throws OptimizerException when neither path has a signature
   */
  public static String extract(Program program) {
    return program
        .signature()
        .or(() -> program.predictor().flatMap(Program::signature))
        .map(TaskSignature::getInstructions)
        .orElseThrow(
            () ->
                new OptimizerException(
                    ErrorKind.INTERNAL, "Compiled program exposes no instructions"));
  }
}
