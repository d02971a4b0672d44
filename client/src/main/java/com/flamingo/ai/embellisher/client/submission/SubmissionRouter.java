package com.flamingo.ai.embellisher.client.submission;

import com.flamingo.ai.embellisher.client.api.NoteApi;
import com.flamingo.ai.embellisher.client.model.NoteSettings;
import com.flamingo.ai.embellisher.client.model.NoteView;
import com.flamingo.ai.embellisher.client.model.UploadFile;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends validated input to the matching creation endpoint. Each call hits exactly one endpoint and
 * completes with the new note id as soon as the server accepted the note.
 */
@Slf4j
@RequiredArgsConstructor
public class SubmissionRouter {

  private final NoteApi noteApi;

  public CompletableFuture<UUID> submitText(String text, NoteSettings settings) {
    log.debug("Submitting text note ({} chars)", text.length());
    return noteApi.createTextNote(text, settings).thenApply(NoteView::id);
  }

  /**
   * Submits one image to the single-image endpoint, or several to the multi-image endpoint where
   * the pages are read together.
   *
   * @throws IllegalArgumentException if {@code files} is empty
   */
  public CompletableFuture<UUID> submitImages(List<UploadFile> files, NoteSettings settings) {
    SubmissionPath path = pathFor(files.size());
    log.debug("Submitting {} file(s) via {}", files.size(), path);
    CompletableFuture<NoteView> created =
        path == SubmissionPath.SINGLE_IMAGE
            ? noteApi.createSingleImageNote(files.get(0), settings)
            : noteApi.createMultiImageNote(List.copyOf(files), settings);
    return created.thenApply(NoteView::id);
  }

  static SubmissionPath pathFor(int imageCount) {
    if (imageCount < 1) {
      throw new IllegalArgumentException("At least one image is required, got " + imageCount);
    }
    return imageCount == 1 ? SubmissionPath.SINGLE_IMAGE : SubmissionPath.MULTI_IMAGE;
  }
}
