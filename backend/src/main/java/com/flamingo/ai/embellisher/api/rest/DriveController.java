package com.flamingo.ai.embellisher.api.rest;

import com.flamingo.ai.embellisher.api.dto.response.DriveAuthUrlResponse;
import com.flamingo.ai.embellisher.api.dto.response.DriveStatusResponse;
import com.flamingo.ai.embellisher.api.dto.response.DriveUploadResponse;
import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import com.flamingo.ai.embellisher.exception.DriveProviderException;
import com.flamingo.ai.embellisher.exception.UnauthorizedException;
import com.flamingo.ai.embellisher.security.AuthenticatedUser;
import com.flamingo.ai.embellisher.security.BearerTokenInterceptor;
import com.flamingo.ai.embellisher.service.drive.DriveBridgeService;
import com.flamingo.ai.embellisher.service.drive.DriveBridgeService.AuthorizationRequest;
import java.net.URI;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

/** REST controller for the cloud drive connection and uploads. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class DriveController {

  private final DriveBridgeService driveBridgeService;
  private final EmbellisherProperties properties;

  @GetMapping("/drive/status")
  public ResponseEntity<DriveStatusResponse> status(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user) {
    return ResponseEntity.ok(DriveStatusResponse.from(driveBridgeService.status(user.userId())));
  }

  @GetMapping("/drive/auth-url")
  public ResponseEntity<DriveAuthUrlResponse> authorizationUrl(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user) {
    AuthorizationRequest request = driveBridgeService.authorizationUrl(user.userId());
    return ResponseEntity.ok(new DriveAuthUrlResponse(request.authUrl(), request.state()));
  }

  /**
   * OAuth redirect target. Not behind the bearer guard; the state token identifies the user.
   * Always answers with a redirect to the configured success page carrying the outcome.
   */
  @GetMapping("/drive/callback")
  public ResponseEntity<Void> callback(
      @RequestParam(required = false) String state,
      @RequestParam(required = false) String code,
      @RequestParam(required = false) String error) {
    String outcome;
    if (error != null || state == null || code == null) {
      log.warn("Drive authorization was not granted: {}", error);
      outcome = "denied";
    } else {
      try {
        driveBridgeService.completeAuthorization(state, code);
        outcome = "connected";
      } catch (UnauthorizedException | DriveProviderException e) {
        log.warn("Drive authorization failed: {}", e.getMessage());
        outcome = "failed";
      }
    }
    URI target =
        UriComponentsBuilder.fromUriString(properties.getDrive().getSuccessRedirect())
            .queryParam("drive", outcome)
            .build()
            .toUri();
    return ResponseEntity.status(HttpStatus.FOUND).location(target).build();
  }

  /** Uploads an artifact of the note, generating it first if necessary. */
  @PostMapping("/notes/{noteId}/drive-upload")
  public ResponseEntity<DriveUploadResponse> upload(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user,
      @PathVariable UUID noteId,
      @RequestParam(defaultValue = "pdf") String format) {
    ExportFormat exportFormat = ExportFormat.fromValue(format);
    return ResponseEntity.ok(
        DriveUploadResponse.from(driveBridgeService.upload(user.userId(), noteId, exportFormat)));
  }
}
