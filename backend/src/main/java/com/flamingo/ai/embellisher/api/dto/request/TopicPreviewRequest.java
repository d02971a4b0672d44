package com.flamingo.ai.embellisher.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for topic suggestions. Length is checked by the service. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TopicPreviewRequest {

  @NotNull(message = "Text is required")
  private String text;
}
