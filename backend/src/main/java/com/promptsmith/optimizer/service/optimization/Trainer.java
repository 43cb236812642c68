package com.promptsmith.optimizer.service.optimization;

import com.promptsmith.optimizer.service.program.Program;

/**
 * Optimizes a program against a metric. Implementations return a new program; the input program
 * is left untouched.
 */
public interface Trainer {

  Program compile(TrainingSpec spec);
}
