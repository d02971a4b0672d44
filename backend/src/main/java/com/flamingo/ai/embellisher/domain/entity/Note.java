package com.flamingo.ai.embellisher.domain.entity;

import com.flamingo.ai.embellisher.domain.converter.ProcessingSettingsConverter;
import com.flamingo.ai.embellisher.domain.converter.StringListConverter;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import com.flamingo.ai.embellisher.domain.enums.InputType;
import com.flamingo.ai.embellisher.domain.enums.NoteStatus;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import com.flamingo.ai.embellisher.exception.InvalidNoteTransitionException;
import com.flamingo.ai.embellisher.exception.NoteNotReadyException;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

/**
 * A submitted note and everything derived from it.
 *
 * <p>Status changes go through the transition methods below, which enforce the lifecycle
 * PENDING, PROCESSING, then COMPLETED or ERROR. Progress only moves forward while processing.
 */
@Entity
@Table(name = "notes")
@DynamicUpdate
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Note {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String ownerId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private InputType inputType;

  /** Typed text; null for image submissions. */
  @Column(columnDefinition = "TEXT")
  private String originalText;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> sourceFileNames = new ArrayList<>();

  @Convert(converter = ProcessingSettingsConverter.class)
  @Column(columnDefinition = "TEXT", nullable = false)
  @Builder.Default
  private ProcessingSettings settings = new ProcessingSettings();

  @Column(columnDefinition = "TEXT")
  private String enhancedContent;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private NoteStatus status = NoteStatus.PENDING;

  @Builder.Default private int progress = 0;

  private String progressMessage;

  /** Error message if processing failed. */
  @Column(columnDefinition = "TEXT")
  private String processingError;

  private String pdfLocation;
  private String docxLocation;
  private String txtLocation;

  @OneToMany(mappedBy = "note", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("createdAt ASC")
  @Builder.Default
  private List<Flashcard> flashcards = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  private LocalDateTime completedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Marks the note as picked up by a worker. */
  public void startProcessing(String message) {
    transitionTo(NoteStatus.PROCESSING);
    this.progressMessage = message;
  }

  /**
   * Records pipeline progress. Values below the current progress are ignored; the message is only
   * replaced together with an accepted value.
   *
   * @return true if the update was applied
   */
  public boolean advanceProgress(int value, String message) {
    if (status != NoteStatus.PROCESSING) {
      throw new InvalidNoteTransitionException(id, status, NoteStatus.PROCESSING);
    }
    int bounded = Math.max(0, Math.min(100, value));
    if (bounded < progress) {
      return false;
    }
    this.progress = bounded;
    this.progressMessage = message;
    return true;
  }

  /** Marks the note as completed with its enhanced content. */
  public void markCompleted(String content) {
    transitionTo(NoteStatus.COMPLETED);
    this.enhancedContent = content;
    this.progress = 100;
    this.progressMessage = "Processing complete";
    this.completedAt = LocalDateTime.now();
  }

  /** Marks the note as failed; the message is shown to the user as-is. */
  public void markFailed(String errorMessage) {
    transitionTo(NoteStatus.ERROR);
    this.processingError = errorMessage;
    this.progressMessage = errorMessage;
  }

  public boolean isReadyForExport() {
    return status == NoteStatus.COMPLETED && enhancedContent != null;
  }

  public String getArtifactLocation(ExportFormat format) {
    return switch (format) {
      case PDF -> pdfLocation;
      case DOCX -> docxLocation;
      case TXT -> txtLocation;
    };
  }

  /** Records where an exported artifact was stored. Only completed notes carry artifacts. */
  public void recordArtifact(ExportFormat format, String location) {
    if (!isReadyForExport()) {
      throw new NoteNotReadyException(id, status);
    }
    switch (format) {
      case PDF -> this.pdfLocation = location;
      case DOCX -> this.docxLocation = location;
      case TXT -> this.txtLocation = location;
    }
  }

  public void addFlashcard(Flashcard flashcard) {
    flashcard.setNote(this);
    flashcards.add(flashcard);
  }

  private void transitionTo(NoteStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new InvalidNoteTransitionException(id, status, next);
    }
    this.status = next;
  }
}
