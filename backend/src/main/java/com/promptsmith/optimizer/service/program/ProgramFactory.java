package com.promptsmith.optimizer.service.program;

import java.util.List;

import org.springframework.stereotype.Component;

import com.promptsmith.optimizer.exception.ConfigException;
import com.promptsmith.optimizer.service.PromptService;
import com.promptsmith.optimizer.service.config.ProgramVariant;
import com.promptsmith.optimizer.service.llm.BoundLanguageModel;
import com.promptsmith.optimizer.service.llm.ResponseParser;
import com.promptsmith.optimizer.service.signature.TaskSignature;

import lombok.RequiredArgsConstructor;

/** Instantiates the configured program variant around a signature. */
@Component
@RequiredArgsConstructor
public class ProgramFactory {

  private final PromptService promptService;
  private final ResponseParser responseParser;

  public Program create(
      ProgramVariant variant,
      TaskSignature signature,
      List<String> tools,
      BoundLanguageModel model) {
    PredictModule base =
        PredictModule.builder()
            .taskSignature(signature)
            .model(model)
            .promptService(promptService)
            .responseParser(responseParser)
            .build();

    switch (variant) {
      case PREDICT:
        return base;
      case CHAIN_OF_THOUGHT:
        return ReasoningProgram.chainOfThought(base);
      case PROGRAM_OF_THOUGHT:
        return ReasoningProgram.programOfThought(base);
      case REACT:
        if (tools == null || tools.isEmpty()) {
          throw new ConfigException("The REACT program module requires at least one tool");
        }
        return new ReActProgram(base, tools);
      default:
        throw new ConfigException("Unsupported program variant: " + variant);
    }
  }
}
