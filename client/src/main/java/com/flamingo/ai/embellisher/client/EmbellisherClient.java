package com.flamingo.ai.embellisher.client;

import com.flamingo.ai.embellisher.client.api.NoteApi;
import com.flamingo.ai.embellisher.client.api.WebClientNoteApi;
import com.flamingo.ai.embellisher.client.drive.AuthorizationSurface;
import com.flamingo.ai.embellisher.client.drive.DriveConnectFlow;
import com.flamingo.ai.embellisher.client.drive.DriveUploadCoordinator;
import com.flamingo.ai.embellisher.client.model.ArtifactReference;
import com.flamingo.ai.embellisher.client.model.DriveUpload;
import com.flamingo.ai.embellisher.client.model.ExportFormat;
import com.flamingo.ai.embellisher.client.model.NoteSettings;
import com.flamingo.ai.embellisher.client.model.NoteView;
import com.flamingo.ai.embellisher.client.model.UploadFile;
import com.flamingo.ai.embellisher.client.polling.PollHandle;
import com.flamingo.ai.embellisher.client.polling.PollListener;
import com.flamingo.ai.embellisher.client.polling.PollingScope;
import com.flamingo.ai.embellisher.client.polling.StatusPoller;
import com.flamingo.ai.embellisher.client.progress.ProcessingEstimate;
import com.flamingo.ai.embellisher.client.progress.ProgressTimeEstimator;
import com.flamingo.ai.embellisher.client.submission.SubmissionRouter;
import com.flamingo.ai.embellisher.client.validation.InputRejectedException;
import com.flamingo.ai.embellisher.client.validation.InputValidator;
import com.flamingo.ai.embellisher.client.validation.SelectedFile;
import com.flamingo.ai.embellisher.client.validation.ValidationResult;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Entry point for applications: validates input, submits it, and watches processing.
 *
 * <pre>{@code
 * try (PollingScope scope = PollingScope.create()) {
 *   Submission submission = client.submitText(text, settings, scope, listener);
 *   NoteView done = submission.completion().result().get();
 * }
 * }</pre>
 */
public class EmbellisherClient {

  private final NoteApi noteApi;
  private final InputValidator validator = new InputValidator();
  private final ProgressTimeEstimator estimator = new ProgressTimeEstimator();
  private final SubmissionRouter router;
  private final StatusPoller statusPoller;
  private final DriveUploadCoordinator driveUploads;

  public EmbellisherClient(
      String baseUrl, Supplier<String> tokenSupplier, AuthorizationSurface surface) {
    this(new WebClientNoteApi(baseUrl, tokenSupplier), surface);
  }

  public EmbellisherClient(NoteApi noteApi, AuthorizationSurface surface) {
    this.noteApi = noteApi;
    this.router = new SubmissionRouter(noteApi);
    this.statusPoller = new StatusPoller(noteApi);
    this.driveUploads =
        new DriveUploadCoordinator(noteApi, new DriveConnectFlow(noteApi, surface));
  }

  /**
   * Validates and submits typed text, then watches the note.
   *
   * @throws InputRejectedException if the text is empty
   */
  public CompletableFuture<Submission> submitText(
      String text, NoteSettings settings, PollingScope scope, PollListener<NoteView> listener) {
    requireAccepted(validator.validateText(text));
    ProcessingEstimate estimate = estimator.forText(text);
    return router
        .submitText(text, settings)
        .thenApply(id -> watch(id, estimate, scope, listener));
  }

  /**
   * Validates and submits one or more images, then watches the note.
   *
   * @throws InputRejectedException if no files are given or they violate the upload constraints
   */
  public CompletableFuture<Submission> submitImages(
      List<UploadFile> files,
      NoteSettings settings,
      PollingScope scope,
      PollListener<NoteView> listener) {
    List<SelectedFile> selection =
        files == null ? List.of() : files.stream().map(UploadFile::selection).toList();
    requireAccepted(validator.validateFiles(selection));
    ProcessingEstimate estimate = estimator.forImages(files.size());
    return router
        .submitImages(files, settings)
        .thenApply(id -> watch(id, estimate, scope, listener));
  }

  public CompletableFuture<ArtifactReference> export(UUID noteId, ExportFormat format) {
    return noteApi.generateArtifact(noteId, format);
  }

  public CompletableFuture<DriveUpload> uploadToDrive(
      UUID noteId, ExportFormat format, PollingScope scope) {
    return driveUploads.upload(noteId, format, scope);
  }

  public CompletableFuture<List<String>> previewTopics(String text) {
    return noteApi.previewTopics(text);
  }

  private Submission watch(
      UUID noteId,
      ProcessingEstimate estimate,
      PollingScope scope,
      PollListener<NoteView> listener) {
    return new Submission(noteId, estimate, statusPoller.watch(noteId, estimate, scope, listener));
  }

  private static void requireAccepted(ValidationResult result) {
    if (!result.isAccepted()) {
      throw new InputRejectedException(result);
    }
  }

  /** A submitted note and the loop watching it. */
  public record Submission(
      UUID noteId, ProcessingEstimate estimate, PollHandle<NoteView> completion) {}
}
