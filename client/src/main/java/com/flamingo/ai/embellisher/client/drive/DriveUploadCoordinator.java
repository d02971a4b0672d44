package com.flamingo.ai.embellisher.client.drive;

import com.flamingo.ai.embellisher.client.api.DriveNotConnectedException;
import com.flamingo.ai.embellisher.client.api.NoteApi;
import com.flamingo.ai.embellisher.client.model.DriveUpload;
import com.flamingo.ai.embellisher.client.model.ExportFormat;
import com.flamingo.ai.embellisher.client.polling.PollingScope;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Uploads an export to the cloud drive. If the drive is not connected, runs the connect flow once
 * and retries the upload once; any further failure is final.
 */
@Slf4j
@RequiredArgsConstructor
public class DriveUploadCoordinator {

  private final NoteApi noteApi;
  private final DriveConnectFlow connectFlow;

  public CompletableFuture<DriveUpload> upload(
      UUID noteId, ExportFormat format, PollingScope scope) {
    return noteApi
        .uploadToDrive(noteId, format)
        .exceptionallyCompose(
            error -> {
              Throwable cause = unwrap(error);
              if (!(cause instanceof DriveNotConnectedException)) {
                return CompletableFuture.failedFuture(cause);
              }
              log.info("Drive not connected, starting connect flow before retrying upload");
              return connectFlow
                  .connect(scope)
                  .thenCompose(status -> noteApi.uploadToDrive(noteId, format));
            });
  }

  private static Throwable unwrap(Throwable error) {
    return error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
  }
}
