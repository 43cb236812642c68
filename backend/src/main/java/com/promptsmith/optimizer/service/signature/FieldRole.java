package com.promptsmith.optimizer.service.signature;

public enum FieldRole {
  INPUT,
  OUTPUT
}
