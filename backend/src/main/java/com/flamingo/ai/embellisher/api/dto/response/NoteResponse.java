package com.flamingo.ai.embellisher.api.dto.response;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.InputType;
import com.flamingo.ai.embellisher.domain.enums.NoteStatus;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for note data, including progress and artifact locations. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NoteResponse {

  private UUID id;
  private InputType inputType;
  private NoteStatus status;
  private int progress;
  private String progressMessage;
  private String processingError;
  private String originalText;
  private List<String> sourceFileNames;
  private String enhancedContent;
  private ProcessingSettings settings;
  private String pdfUrl;
  private String docxUrl;
  private String txtUrl;
  private List<FlashcardResponse> flashcards;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;
  private LocalDateTime completedAt;

  /** Full projection used by the detail and polling endpoints. */
  public static NoteResponse fromEntity(Note note) {
    return base(note)
        .originalText(note.getOriginalText())
        .enhancedContent(note.getEnhancedContent())
        .settings(note.getSettings())
        .flashcards(note.getFlashcards().stream().map(FlashcardResponse::fromEntity).toList())
        .build();
  }

  /** List projection without content and flashcards. */
  public static NoteResponse summaryOf(Note note) {
    return base(note).flashcards(List.of()).build();
  }

  private static NoteResponseBuilder base(Note note) {
    return NoteResponse.builder()
        .id(note.getId())
        .inputType(note.getInputType())
        .status(note.getStatus())
        .progress(note.getProgress())
        .progressMessage(note.getProgressMessage())
        .processingError(note.getProcessingError())
        .sourceFileNames(List.copyOf(note.getSourceFileNames()))
        .pdfUrl(note.getPdfLocation())
        .docxUrl(note.getDocxLocation())
        .txtUrl(note.getTxtLocation())
        .createdAt(note.getCreatedAt())
        .updatedAt(note.getUpdatedAt())
        .completedAt(note.getCompletedAt());
  }
}
