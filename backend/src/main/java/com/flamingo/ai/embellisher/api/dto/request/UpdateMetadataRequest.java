package com.flamingo.ai.embellisher.api.dto.request;

import com.flamingo.ai.embellisher.domain.model.ProcessingSettings.PresentationMetadata;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for updating the presentation metadata of a note. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateMetadataRequest {

  @Size(max = 200, message = "Project name must be at most 200 characters")
  private String projectName;

  @Size(max = 200, message = "Title must be at most 200 characters")
  private String title;

  @Size(max = 100, message = "Nickname must be at most 100 characters")
  private String nickname;

  private boolean includeNickname;

  public PresentationMetadata toMetadata() {
    return PresentationMetadata.builder()
        .projectName(projectName)
        .title(title)
        .nickname(nickname)
        .includeNickname(includeNickname)
        .build();
  }
}
