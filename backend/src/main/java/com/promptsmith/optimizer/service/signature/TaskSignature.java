package com.promptsmith.optimizer.service.signature;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * Fixed description of a task: its instruction text and which record fields are inputs and which
 * are expected outputs, in declaration order.
 */
@Value
public class TaskSignature {

  String name;
  String instructions;
  List<SignatureField> fields;

  public TaskSignature(String name, String instructions, List<SignatureField> fields) {
    this.name = name;
    this.instructions = instructions;
    this.fields = List.copyOf(fields);
  }

  public List<String> inputFieldNames() {
    return namesFor(FieldRole.INPUT);
  }

  public List<String> outputFieldNames() {
    return namesFor(FieldRole.OUTPUT);
  }

  public TaskSignature withInstructions(String newInstructions) {
    return new TaskSignature(name, newInstructions, fields);
  }

  private List<String> namesFor(FieldRole role) {
    return fields.stream()
        .filter(f -> f.getRole() == role)
        .map(SignatureField::getName)
        .collect(Collectors.toList());
  }
}
