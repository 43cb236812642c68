package com.promptsmith.optimizer.service.signature;

import lombok.Value;

@Value
public class SignatureField {
  String name;
  FieldRole role;
}
