package com.flamingo.ai.embellisher.api.dto.request;

import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for submitting typed note text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTextNoteRequest {

  @NotBlank(message = "Text is required")
  @Size(max = 100_000, message = "Text must be at most 100000 characters")
  private String text;

  @Valid
  @NotNull(message = "Settings are required")
  private ProcessingSettings settings;
}
