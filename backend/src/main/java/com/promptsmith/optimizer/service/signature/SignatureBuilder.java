package com.promptsmith.optimizer.service.signature;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.google.common.base.CharMatcher;
import com.promptsmith.optimizer.exception.ConfigException;

import lombok.extern.slf4j.Slf4j;

/** Turns ordered input/output field name lists into a validated {@link TaskSignature}. */
@Slf4j
@Component
public class SignatureBuilder {

  static final CharMatcher FIELD_NAME_TRIM =
      CharMatcher.anyOf("\"'`").or(CharMatcher.whitespace());

  private static final CharMatcher SIGNATURE_NAME_TRIM =
      CharMatcher.is('_').or(CharMatcher.whitespace());

  /**
   * Builds the signature. Names are stripped of surrounding quotes and whitespace; repeated names
   * within one role keep their first position.
   *
   * @throws ConfigException when a role has no fields, a name is blank, or a name is declared as
   *     both input and output
   */
  public TaskSignature build(
      String name, String instructions, List<String> inputFields, List<String> outputFields) {
    Set<String> inputs = clean(inputFields, FieldRole.INPUT);
    Set<String> outputs = clean(outputFields, FieldRole.OUTPUT);

    for (String input : inputs) {
      if (outputs.contains(input)) {
        throw new ConfigException(
            "Field '" + input + "' cannot be both an input and an output field");
      }
    }

    List<SignatureField> fields = new ArrayList<>(inputs.size() + outputs.size());
    inputs.forEach(n -> fields.add(new SignatureField(n, FieldRole.INPUT)));
    outputs.forEach(n -> fields.add(new SignatureField(n, FieldRole.OUTPUT)));

    String signatureName = name == null ? "" : SIGNATURE_NAME_TRIM.trimFrom(name);
    log.debug("Built signature '{}' inputs={} outputs={}", signatureName, inputs, outputs);
    return new TaskSignature(
        signatureName.isEmpty() ? "TaskSignature" : signatureName,
        instructions == null ? "" : instructions.trim(),
        fields);
  }

  private Set<String> clean(List<String> names, FieldRole role) {
    if (names == null || names.isEmpty()) {
      throw new ConfigException(
          "At least one " + role.name().toLowerCase() + " field is required");
    }
    Set<String> cleaned = new LinkedHashSet<>();
    for (String raw : names) {
      String name = raw == null ? "" : FIELD_NAME_TRIM.trimFrom(raw);
      if (name.isEmpty()) {
        throw new ConfigException("Blank " + role.name().toLowerCase() + " field name");
      }
      cleaned.add(name);
    }
    return cleaned;
  }
}
