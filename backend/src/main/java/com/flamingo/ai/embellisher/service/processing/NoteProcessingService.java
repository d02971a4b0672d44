package com.flamingo.ai.embellisher.service.processing;

import com.flamingo.ai.embellisher.domain.entity.Flashcard;
import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import com.flamingo.ai.embellisher.domain.repository.NoteRepository;
import com.flamingo.ai.embellisher.exception.NoteNotFoundException;
import com.flamingo.ai.embellisher.exception.NoteProcessingException;
import com.flamingo.ai.embellisher.service.note.UploadedImage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs the extract, enhance and flashcard pipeline for a note on the processing executor.
 *
 * <p>Every step reports progress through {@link NoteProgressTracker}. Any failure moves the note to
 * ERROR with the underlying message, so the client sees what the AI service reported.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NoteProcessingService {

  static final int PROGRESS_EXTRACTING = 10;
  static final int PROGRESS_ENHANCING = 40;
  static final int PROGRESS_FLASHCARDS = 80;

  private final NoteRepository noteRepository;
  private final NoteProgressTracker progressTracker;
  private final ImageTextExtractionService extractionService;
  private final ContentEnhancementService enhancementService;
  private final FlashcardGenerationService flashcardService;
  private final MeterRegistry meterRegistry;

  /** Enhances a typed note. */
  @Timed(value = "note.process", extraTags = {"input", "text"})
  @Async("noteProcessingExecutor")
  public void processText(UUID noteId) {
    run(
        noteId,
        "Preparing your notes",
        note -> {
          if (note.getOriginalText() == null || note.getOriginalText().isBlank()) {
            throw new NoteProcessingException(noteId, "The note has no text to enhance");
          }
          return note.getOriginalText();
        });
  }

  /** Extracts text from one or more uploads, then enhances it. */
  @Timed(value = "note.process", extraTags = {"input", "image"})
  @Async("noteProcessingExecutor")
  public void processImages(UUID noteId, List<UploadedImage> uploads) {
    String startMessage =
        uploads.size() == 1
            ? "Extracting text from image"
            : "Extracting text from " + uploads.size() + " pages";
    run(
        noteId,
        startMessage,
        note -> {
          progressTracker.reportProgress(noteId, PROGRESS_EXTRACTING, startMessage);
          String text = extractionService.extract(uploads);
          if (text.isBlank()) {
            throw new NoteProcessingException(noteId, "No readable text was found in the upload");
          }
          log.debug("Extracted {} chars for note {}", text.length(), noteId);
          return text;
        });
  }

  private void run(UUID noteId, String startMessage, SourceTextStep sourceStep) {
    try {
      Note note =
          noteRepository.findById(noteId).orElseThrow(() -> new NoteNotFoundException(noteId));
      progressTracker.markProcessing(noteId, startMessage);

      String sourceText = sourceStep.apply(note);
      ProcessingSettings settings = note.getSettings();

      progressTracker.reportProgress(noteId, PROGRESS_ENHANCING, "Enhancing content");
      String enhanced = enhancementService.enhance(sourceText, settings);

      List<Flashcard> flashcards = List.of();
      if (settings.isFlashcardsRequested()) {
        progressTracker.reportProgress(noteId, PROGRESS_FLASHCARDS, "Generating flashcards");
        flashcards = generateFlashcards(noteId, enhanced, settings);
      }

      progressTracker.complete(noteId, enhanced, flashcards);
      meterRegistry.counter("note.processing.success").increment();
      log.info(
          "Note {} processed: {} chars, {} flashcards",
          noteId,
          enhanced.length(),
          flashcards.size());

    } catch (Exception e) {
      log.error("Failed to process note {}: {}", noteId, e.getMessage(), e);
      meterRegistry.counter("note.processing.failure").increment();
      try {
        progressTracker.fail(noteId, describe(e));
      } catch (Exception statusEx) {
        log.error("Failed to record failure of note {}: {}", noteId, statusEx.getMessage());
      }
    }
  }

  /**
   * Flashcards are optional output; a failure here is logged and the note still completes with its
   * enhanced content.
   */
  private List<Flashcard> generateFlashcards(
      UUID noteId, String enhanced, ProcessingSettings settings) {
    try {
      return flashcardService.generate(enhanced, settings.getFlashcards());
    } catch (RuntimeException e) {
      log.warn("Flashcard generation failed for note {}: {}", noteId, e.getMessage());
      meterRegistry.counter("note.flashcards.failure").increment();
      return List.of();
    }
  }

  private static String describe(Exception e) {
    return e.getMessage() != null && !e.getMessage().isBlank()
        ? e.getMessage()
        : e.getClass().getSimpleName();
  }

  /** Produces the text that gets enhanced. */
  @FunctionalInterface
  private interface SourceTextStep {
    String apply(Note note);
  }
}
