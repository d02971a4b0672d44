package com.flamingo.ai.embellisher.service.note;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.InputType;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings.PresentationMetadata;
import com.flamingo.ai.embellisher.domain.repository.NoteRepository;
import com.flamingo.ai.embellisher.exception.InputValidationException;
import com.flamingo.ai.embellisher.exception.InputValidationException.Reason;
import com.flamingo.ai.embellisher.exception.NoteNotFoundException;
import com.flamingo.ai.embellisher.service.export.storage.ArtifactStorage;
import com.flamingo.ai.embellisher.service.processing.NoteProcessingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the NoteService. */
@Service
@Slf4j
public class NoteServiceImpl implements NoteService {

  private final NoteRepository noteRepository;
  private final UploadValidator uploadValidator;
  private final NoteProcessingService processingService;
  private final ArtifactStorage artifactStorage;
  private final MeterRegistry meterRegistry;

  public NoteServiceImpl(
      NoteRepository noteRepository,
      UploadValidator uploadValidator,
      @Lazy NoteProcessingService processingService,
      ArtifactStorage artifactStorage,
      MeterRegistry meterRegistry) {
    this.noteRepository = noteRepository;
    this.uploadValidator = uploadValidator;
    this.processingService = processingService;
    this.artifactStorage = artifactStorage;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Transactional
  @Timed(value = "note.create", extraTags = {"input", "text"})
  public Note createTextNote(String ownerId, String text, ProcessingSettings settings) {
    String validText = uploadValidator.validateText(text);
    Note saved =
        noteRepository.save(
            Note.builder()
                .ownerId(ownerId)
                .inputType(InputType.TEXT)
                .originalText(validText)
                .settings(settings.normalized())
                .build());

    UUID noteId = saved.getId();
    afterCommit(noteId, () -> processingService.processText(noteId));
    recordCreated(InputType.TEXT);
    log.info("Text note {} created for user {}", noteId, ownerId);
    return saved;
  }

  @Override
  @Transactional
  @Timed(value = "note.create", extraTags = {"input", "single_image"})
  public Note createSingleImageNote(
      String ownerId, MultipartFile file, ProcessingSettings settings) {
    List<UploadedImage> uploads = uploadValidator.validate(List.of(file));
    return createImageNote(ownerId, InputType.SINGLE_IMAGE, uploads, settings);
  }

  @Override
  @Transactional
  @Timed(value = "note.create", extraTags = {"input", "multi_image"})
  public Note createMultiImageNote(
      String ownerId, List<MultipartFile> files, ProcessingSettings settings) {
    List<UploadedImage> uploads = uploadValidator.validate(files);
    if (uploads.size() < 2) {
      throw new InputValidationException(
          Reason.NO_FILES, "Multi-page notes need at least two files");
    }
    return createImageNote(ownerId, InputType.MULTI_IMAGE, uploads, settings);
  }

  @Override
  @Transactional(readOnly = true)
  public Note getNote(String ownerId, UUID noteId) {
    Note note =
        noteRepository
            .findByIdAndOwnerId(noteId, ownerId)
            .orElseThrow(() -> new NoteNotFoundException(noteId));
    // Initialize the lazy collection for the response projection
    note.getFlashcards().size();
    return note;
  }

  @Override
  @Transactional(readOnly = true)
  public List<Note> listNotes(String ownerId) {
    return noteRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
  }

  @Override
  @Transactional
  public Note updateMetadata(String ownerId, UUID noteId, PresentationMetadata metadata) {
    Note note = getNote(ownerId, noteId);
    note.setSettings(note.getSettings().toBuilder().presentation(metadata).build());
    log.info("Updated presentation metadata of note {}", noteId);
    return noteRepository.save(note);
  }

  @Override
  @Transactional
  public void deleteNote(String ownerId, UUID noteId) {
    Note note = getNote(ownerId, noteId);
    noteRepository.delete(note);
    artifactStorage.deleteAll(noteId);
    meterRegistry.counter("note.deleted").increment();
    log.info("Deleted note {}", noteId);
  }

  private Note createImageNote(
      String ownerId,
      InputType inputType,
      List<UploadedImage> uploads,
      ProcessingSettings settings) {
    Note saved =
        noteRepository.save(
            Note.builder()
                .ownerId(ownerId)
                .inputType(inputType)
                .sourceFileNames(uploads.stream().map(UploadedImage::fileName).toList())
                .settings(settings.normalized())
                .build());

    UUID noteId = saved.getId();
    afterCommit(noteId, () -> processingService.processImages(noteId, uploads));
    recordCreated(inputType);
    log.info(
        "{} note {} created for user {} with {} file(s)",
        inputType,
        noteId,
        ownerId,
        uploads.size());
    return saved;
  }

  /** Starts processing only once the note row is visible to the worker's transaction. */
  private void afterCommit(UUID noteId, Runnable start) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug("Transaction committed, starting processing for note {}", noteId);
              start.run();
            }
          });
    } else {
      log.debug("No active transaction, starting processing for note {} directly", noteId);
      start.run();
    }
  }

  private void recordCreated(InputType inputType) {
    meterRegistry.counter("note.created", "input", inputType.name().toLowerCase()).increment();
  }
}
