package com.promptsmith.optimizer.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Replacement for a session's human input")
public class InputUpdateRequest {

  @NotBlank(message = "input is required")
  private String input;
}
