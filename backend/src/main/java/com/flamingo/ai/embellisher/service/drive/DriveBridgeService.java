package com.flamingo.ai.embellisher.service.drive;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.domain.entity.DriveConnection;
import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import com.flamingo.ai.embellisher.domain.repository.DriveConnectionRepository;
import com.flamingo.ai.embellisher.domain.repository.NoteRepository;
import com.flamingo.ai.embellisher.exception.DriveNotConnectedException;
import com.flamingo.ai.embellisher.exception.DriveProviderException;
import com.flamingo.ai.embellisher.exception.NoteNotFoundException;
import com.flamingo.ai.embellisher.exception.UnauthorizedException;
import com.flamingo.ai.embellisher.service.drive.GoogleDriveClient.DriveFile;
import com.flamingo.ai.embellisher.service.drive.GoogleDriveClient.TokenResponse;
import com.flamingo.ai.embellisher.service.export.ArtifactExportService;
import com.flamingo.ai.embellisher.service.export.ExportDocumentTitles;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Connects user accounts to the cloud drive and uploads exported artifacts.
 *
 * <p>An upload produces the artifact first if it does not exist yet, using the same cached
 * location as a direct export. Credentials that the provider no longer accepts are cleared and
 * reported as "not connected" so the client can run the connect flow again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriveBridgeService {

  private static final long EXPIRY_SKEW_SECONDS = 60;
  private static final SecureRandom RANDOM = new SecureRandom();

  private final DriveConnectionRepository connectionRepository;
  private final NoteRepository noteRepository;
  private final GoogleDriveClient driveClient;
  private final ArtifactExportService exportService;
  private final EmbellisherProperties properties;
  private final MeterRegistry meterRegistry;

  public DriveStatus status(String ownerId) {
    return connectionRepository
        .findById(ownerId)
        .filter(DriveConnection::isConnected)
        .map(c -> new DriveStatus(true, c.getExpiresAt(), c.getRefreshToken() != null))
        .orElse(new DriveStatus(false, null, false));
  }

  /** Issues an authorization URL and remembers its state token for the callback. */
  public AuthorizationRequest authorizationUrl(String ownerId) {
    EmbellisherProperties.Drive drive = properties.getDrive();
    if (drive.getClientId() == null || drive.getClientId().isBlank()) {
      throw new DriveProviderException("Cloud drive integration is not configured", 0);
    }

    byte[] stateBytes = new byte[32];
    RANDOM.nextBytes(stateBytes);
    String state = Base64.getUrlEncoder().withoutPadding().encodeToString(stateBytes);

    DriveConnection connection =
        connectionRepository
            .findById(ownerId)
            .orElseGet(() -> DriveConnection.builder().ownerId(ownerId).build());
    connection.setPendingState(state);
    connection.setStateIssuedAt(Instant.now());
    connectionRepository.save(connection);

    String url =
        UriComponentsBuilder.fromUriString(drive.getAuthUri())
            .queryParam("client_id", drive.getClientId())
            .queryParam("redirect_uri", drive.getRedirectUri())
            .queryParam("response_type", "code")
            .queryParam("scope", drive.getScope())
            .queryParam("access_type", "offline")
            .queryParam("include_granted_scopes", "true")
            .queryParam("prompt", "consent")
            .queryParam("state", state)
            .encode()
            .build()
            .toUriString();
    log.info("Issued drive authorization URL for user {}", ownerId);
    return new AuthorizationRequest(url, state);
  }

  /**
   * Completes the OAuth redirect: validates the state and stores the tokens.
   *
   * @return the owner the authorization belongs to
   * @throws UnauthorizedException if the state is unknown or expired
   */
  public String completeAuthorization(String state, String code) {
    DriveConnection connection =
        connectionRepository
            .findByPendingState(state)
            .orElseThrow(() -> new UnauthorizedException("Unknown authorization state"));
    Duration ttl = Duration.ofMinutes(properties.getDrive().getStateTtlMinutes());
    if (connection.getStateIssuedAt() == null
        || connection.getStateIssuedAt().plus(ttl).isBefore(Instant.now())) {
      throw new UnauthorizedException("Authorization state expired");
    }

    TokenResponse tokens;
    try {
      tokens = driveClient.exchangeCode(code);
    } catch (WebClientResponseException | WebClientRequestException e) {
      throw new DriveProviderException("Authorization code exchange failed", e);
    }
    if (tokens == null || tokens.accessToken() == null) {
      throw new DriveProviderException("Token endpoint returned no access token", 0);
    }

    applyTokens(connection, tokens);
    connection.setPendingState(null);
    connection.setStateIssuedAt(null);
    connectionRepository.save(connection);
    meterRegistry.counter("drive.connected").increment();
    log.info("Drive connected for user {}", connection.getOwnerId());
    return connection.getOwnerId();
  }

  /**
   * Uploads a note artifact to the user's drive, generating the artifact if needed.
   *
   * @throws DriveNotConnectedException if the user has no usable credentials
   */
  @Timed(value = "drive.upload", description = "Time to upload an artifact to the drive")
  public DriveUploadResult upload(String ownerId, UUID noteId, ExportFormat format) {
    DriveConnection connection =
        connectionRepository
            .findById(ownerId)
            .filter(DriveConnection::isConnected)
            .orElseThrow(() -> new DriveNotConnectedException(ownerId));
    Note note =
        noteRepository
            .findByIdAndOwnerId(noteId, ownerId)
            .orElseThrow(() -> new NoteNotFoundException(noteId));

    byte[] content = exportService.loadContent(ownerId, noteId, format);
    String accessToken = ensureAccessToken(connection);

    String title = ExportDocumentTitles.title(note);
    String fileName = ExportDocumentTitles.fileSlug(note) + "." + format.getExtension();
    try {
      DriveFile file =
          driveClient.upload(
              accessToken,
              fileName,
              format.getMediaType(),
              "Enhanced notes: " + title,
              properties.getDrive().getFolderId(),
              content);
      meterRegistry.counter("drive.upload.success", "format", format.getExtension()).increment();
      log.info("Uploaded {} of note {} to drive file {}", format, noteId, file.id());
      return new DriveUploadResult(noteId, format, file);
    } catch (WebClientResponseException e) {
      meterRegistry.counter("drive.upload.failure", "format", format.getExtension()).increment();
      if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
        disconnect(connection, "Drive rejected the access token");
      }
      throw new DriveProviderException(
          "Drive upload failed: " + e.getStatusCode().value(), e.getStatusCode().value());
    } catch (WebClientRequestException e) {
      meterRegistry.counter("drive.upload.failure", "format", format.getExtension()).increment();
      throw new DriveProviderException("Drive is unreachable", e);
    }
  }

  private String ensureAccessToken(DriveConnection connection) {
    if (!connection.isAccessTokenExpired(Instant.now(), EXPIRY_SKEW_SECONDS)) {
      return connection.getAccessToken();
    }
    if (connection.getRefreshToken() == null) {
      disconnect(connection, "Access token expired and no refresh token is stored");
    }

    TokenResponse tokens;
    try {
      tokens = driveClient.refresh(connection.getRefreshToken());
    } catch (WebClientResponseException e) {
      if (e.getStatusCode().is4xxClientError()) {
        disconnect(connection, "Refresh token was revoked");
      }
      throw new DriveProviderException("Token refresh failed", e);
    } catch (WebClientRequestException e) {
      throw new DriveProviderException("Token endpoint is unreachable", e);
    }
    applyTokens(connection, tokens);
    connectionRepository.save(connection);
    log.debug("Refreshed drive access token for user {}", connection.getOwnerId());
    return connection.getAccessToken();
  }

  /** Clears stored credentials and raises {@link DriveNotConnectedException}. */
  private void disconnect(DriveConnection connection, String reason) {
    log.warn("Disconnecting drive for user {}: {}", connection.getOwnerId(), reason);
    connection.setAccessToken(null);
    connection.setRefreshToken(null);
    connection.setExpiresAt(null);
    connectionRepository.save(connection);
    throw new DriveNotConnectedException(connection.getOwnerId(), reason);
  }

  private static void applyTokens(DriveConnection connection, TokenResponse tokens) {
    connection.setAccessToken(tokens.accessToken());
    if (tokens.refreshToken() != null) {
      connection.setRefreshToken(tokens.refreshToken());
    }
    long expiresIn = tokens.expiresIn() != null ? tokens.expiresIn() : 3600;
    connection.setExpiresAt(Instant.now().plusSeconds(expiresIn));
  }

  /** Connection state reported to clients. */
  public record DriveStatus(boolean connected, Instant expiresAt, boolean hasRefreshToken) {}

  /** Authorization URL plus the state token it carries. */
  public record AuthorizationRequest(String authUrl, String state) {}

  /** Outcome of an upload. */
  public record DriveUploadResult(UUID noteId, ExportFormat format, DriveFile driveFile) {}
}
