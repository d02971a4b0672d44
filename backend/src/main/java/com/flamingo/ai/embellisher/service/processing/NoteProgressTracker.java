package com.flamingo.ai.embellisher.service.processing;

import com.flamingo.ai.embellisher.domain.entity.Flashcard;
import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.repository.NoteRepository;
import com.flamingo.ai.embellisher.exception.NoteNotFoundException;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persists note state machine transitions from processing workers.
 *
 * <p>Each update runs in its own short transaction so a poller sees progress as soon as it is
 * reported. SQLite allows a single writer; updates that hit lock contention are retried.
 */
@Component
@Slf4j
public class NoteProgressTracker {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final NoteRepository noteRepository;
  private final TransactionTemplate transactionTemplate;

  public NoteProgressTracker(
      NoteRepository noteRepository, PlatformTransactionManager transactionManager) {
    this.noteRepository = noteRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  public void markProcessing(UUID noteId, String message) {
    update(noteId, note -> note.startProcessing(message));
  }

  public void reportProgress(UUID noteId, int progress, String message) {
    update(
        noteId,
        note -> {
          if (!note.advanceProgress(progress, message)) {
            log.debug(
                "Ignoring stale progress {} for note {} (current {})",
                progress,
                noteId,
                note.getProgress());
          }
        });
  }

  public void complete(UUID noteId, String content, List<Flashcard> flashcards) {
    update(
        noteId,
        note -> {
          flashcards.forEach(note::addFlashcard);
          note.markCompleted(content);
        });
  }

  public void fail(UUID noteId, String errorMessage) {
    update(noteId, note -> note.markFailed(errorMessage));
  }

  private void update(UUID noteId, Consumer<Note> change) {
    for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
      try {
        transactionTemplate.executeWithoutResult(
            status -> {
              Note note =
                  noteRepository
                      .findById(noteId)
                      .orElseThrow(() -> new NoteNotFoundException(noteId));
              change.accept(note);
              noteRepository.saveAndFlush(note);
            });
        return;
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update note {} after {} retries", noteId, MAX_RETRIES);
          throw e;
        }
        log.warn("SQLite lock contention on note {}, retry {}/{}", noteId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }
}
