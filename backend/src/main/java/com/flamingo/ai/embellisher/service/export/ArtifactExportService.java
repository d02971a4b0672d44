package com.flamingo.ai.embellisher.service.export;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import com.flamingo.ai.embellisher.domain.repository.NoteRepository;
import com.flamingo.ai.embellisher.exception.NoteNotFoundException;
import com.flamingo.ai.embellisher.exception.NoteNotReadyException;
import com.flamingo.ai.embellisher.service.export.storage.ArtifactStorage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates export artifacts on demand and caches their location on the note.
 *
 * <p>Once a location is recorded for a format it is returned as-is; the converter never runs again
 * for that note and format. Requests for the same note and format are serialized so concurrent
 * callers share a single conversion.
 *
 * <p>Conversion runs outside any transaction. The location is then written against a freshly read
 * note in its own short transaction, so exports of other formats and metadata edits that finished
 * in the meantime are kept.
 */
@Service
@Slf4j
public class ArtifactExportService {

  private final NoteRepository noteRepository;
  private final List<ArtifactConverter> converters;
  private final ArtifactStorage artifactStorage;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;
  private final ConcurrentMap<String, KeyLock> locks = new ConcurrentHashMap<>();

  public ArtifactExportService(
      NoteRepository noteRepository,
      List<ArtifactConverter> converters,
      ArtifactStorage artifactStorage,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.noteRepository = noteRepository;
    this.converters = converters;
    this.artifactStorage = artifactStorage;
    this.meterRegistry = meterRegistry;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Returns the location of the note's artifact in the given format, generating it first if needed.
   *
   * @throws NoteNotFoundException if the note does not exist for this owner
   * @throws NoteNotReadyException if the note is not completed
   */
  @Timed(value = "export.artifact", description = "Time to resolve an export artifact")
  public String generate(String ownerId, UUID noteId, ExportFormat format) {
    String key = noteId + ":" + format;
    KeyLock keyLock = acquire(key);
    try {
      Note note = loadNote(ownerId, noteId);
      String existing = note.getArtifactLocation(format);
      if (existing != null) {
        log.debug("Reusing {} artifact of note {}", format, noteId);
        meterRegistry
            .counter("export.artifact.cached", "format", format.getExtension())
            .increment();
        return existing;
      }
      if (!note.isReadyForExport()) {
        throw new NoteNotReadyException(noteId, note.getStatus());
      }

      byte[] content = converterFor(format).convert(note);
      String location =
          artifactStorage.store(noteId, format, ExportDocumentTitles.fileSlug(note), content);

      String recorded = recordLocation(noteId, format, location);
      meterRegistry
          .counter("export.artifact.generated", "format", format.getExtension())
          .increment();
      log.info("Generated {} artifact for note {} at {}", format, noteId, recorded);
      return recorded;
    } finally {
      release(key, keyLock);
    }
  }

  /** Returns the artifact bytes, generating the artifact first if needed. */
  public byte[] loadContent(String ownerId, UUID noteId, ExportFormat format) {
    return artifactStorage.load(generate(ownerId, noteId, format));
  }

  /** Number of note and format keys currently locked or awaited. */
  int activeLockCount() {
    return locks.size();
  }

  private String recordLocation(UUID noteId, ExportFormat format, String location) {
    String recorded =
        transactionTemplate.execute(
            status -> {
              Note current = noteRepository.findById(noteId).orElse(null);
              if (current == null) {
                return null;
              }
              String existing = current.getArtifactLocation(format);
              if (existing != null) {
                return existing;
              }
              current.recordArtifact(format, location);
              noteRepository.saveAndFlush(current);
              return location;
            });
    if (recorded == null) {
      log.warn("Note {} was deleted while its {} artifact was generated", noteId, format);
      artifactStorage.deleteAll(noteId);
      throw new NoteNotFoundException(noteId);
    }
    return recorded;
  }

  private KeyLock acquire(String key) {
    KeyLock keyLock =
        locks.compute(
            key,
            (k, held) -> {
              KeyLock current = held == null ? new KeyLock() : held;
              current.users++;
              return current;
            });
    keyLock.lock.lock();
    return keyLock;
  }

  private void release(String key, KeyLock keyLock) {
    keyLock.lock.unlock();
    locks.computeIfPresent(key, (k, held) -> --held.users == 0 ? null : held);
  }

  private Note loadNote(String ownerId, UUID noteId) {
    return noteRepository
        .findByIdAndOwnerId(noteId, ownerId)
        .orElseThrow(() -> new NoteNotFoundException(noteId));
  }

  private ArtifactConverter converterFor(ExportFormat format) {
    return converters.stream()
        .filter(converter -> converter.supports(format))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No converter for format " + format));
  }

  /** A lock plus the number of callers holding or waiting for it; only touched inside compute. */
  private static final class KeyLock {
    private final ReentrantLock lock = new ReentrantLock();
    private int users;
  }
}
