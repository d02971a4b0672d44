package com.flamingo.ai.embellisher.api.dto.response;

import com.flamingo.ai.embellisher.service.drive.DriveBridgeService.DriveUploadResult;
import java.util.UUID;

/** Result of uploading an artifact to the drive. */
public record DriveUploadResponse(
    UUID noteId, String format, String fileId, String fileName, String webViewLink) {

  public static DriveUploadResponse from(DriveUploadResult result) {
    return new DriveUploadResponse(
        result.noteId(),
        result.format().getExtension(),
        result.driveFile().id(),
        result.driveFile().name(),
        result.driveFile().webViewLink());
  }
}
