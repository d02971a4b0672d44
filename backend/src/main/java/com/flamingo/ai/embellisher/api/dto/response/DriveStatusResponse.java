package com.flamingo.ai.embellisher.api.dto.response;

import com.flamingo.ai.embellisher.service.drive.DriveBridgeService.DriveStatus;
import java.time.Instant;

/** Drive connection state. */
public record DriveStatusResponse(boolean connected, Instant expiresAt, boolean hasRefreshToken) {

  public static DriveStatusResponse from(DriveStatus status) {
    return new DriveStatusResponse(
        status.connected(), status.expiresAt(), status.hasRefreshToken());
  }
}
