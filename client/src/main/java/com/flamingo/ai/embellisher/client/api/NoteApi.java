package com.flamingo.ai.embellisher.client.api;

import com.flamingo.ai.embellisher.client.model.ArtifactReference;
import com.flamingo.ai.embellisher.client.model.DriveAuthorization;
import com.flamingo.ai.embellisher.client.model.DriveStatus;
import com.flamingo.ai.embellisher.client.model.DriveUpload;
import com.flamingo.ai.embellisher.client.model.ExportFormat;
import com.flamingo.ai.embellisher.client.model.NoteSettings;
import com.flamingo.ai.embellisher.client.model.NoteView;
import com.flamingo.ai.embellisher.client.model.UploadFile;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to the note service. Futures fail with {@link ApiException} (or one of its
 * subtypes) for error responses.
 */
public interface NoteApi {

  CompletableFuture<NoteView> createTextNote(String text, NoteSettings settings);

  CompletableFuture<NoteView> createSingleImageNote(UploadFile file, NoteSettings settings);

  CompletableFuture<NoteView> createMultiImageNote(List<UploadFile> files, NoteSettings settings);

  CompletableFuture<NoteView> getNote(UUID noteId);

  CompletableFuture<ArtifactReference> generateArtifact(UUID noteId, ExportFormat format);

  CompletableFuture<List<String>> previewTopics(String text);

  CompletableFuture<DriveStatus> driveStatus();

  CompletableFuture<DriveAuthorization> driveAuthorizationUrl();

  CompletableFuture<DriveUpload> uploadToDrive(UUID noteId, ExportFormat format);
}
