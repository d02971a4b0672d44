package com.flamingo.ai.embellisher.client.drive;

import com.flamingo.ai.embellisher.client.api.NoteApi;
import com.flamingo.ai.embellisher.client.model.DriveStatus;
import com.flamingo.ai.embellisher.client.polling.PollListener;
import com.flamingo.ai.embellisher.client.polling.PollTimeoutException;
import com.flamingo.ai.embellisher.client.polling.PollUntil;
import com.flamingo.ai.embellisher.client.polling.PollingScope;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Connects the user's cloud drive: opens the consent page and watches the connection status until
 * the server reports it connected.
 *
 * <p>The returned future fails with {@link PollTimeoutException} when the user has not finished
 * within the attempt budget. The surface is closed either way.
 */
@Slf4j
public class DriveConnectFlow {

  public static final int DEFAULT_MAX_ATTEMPTS = 30;
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);

  private final NoteApi noteApi;
  private final AuthorizationSurface surface;
  private final Duration interval;
  private final int maxAttempts;

  public DriveConnectFlow(NoteApi noteApi, AuthorizationSurface surface) {
    this(noteApi, surface, DEFAULT_INTERVAL, DEFAULT_MAX_ATTEMPTS);
  }

  public DriveConnectFlow(
      NoteApi noteApi, AuthorizationSurface surface, Duration interval, int maxAttempts) {
    this.noteApi = noteApi;
    this.surface = surface;
    this.interval = interval;
    this.maxAttempts = maxAttempts;
  }

  public CompletableFuture<DriveStatus> connect(PollingScope scope) {
    return noteApi
        .driveAuthorizationUrl()
        .thenCompose(auth -> watch(URI.create(auth.authUrl()), scope));
  }

  private CompletableFuture<DriveStatus> watch(URI authorizationUrl, PollingScope scope) {
    surface.open(authorizationUrl);
    PollUntil<DriveStatus> poll =
        PollUntil.<DriveStatus>builder("drive connect")
            .query(noteApi::driveStatus)
            .until(DriveStatus::connected)
            .interval(interval)
            .initialDelay(interval)
            .maxAttempts(maxAttempts)
            .build();
    CompletableFuture<DriveStatus> connected =
        scope.start(poll, new PollListener<>() {}).result();
    return connected.whenComplete(
        (status, error) -> {
          surface.close();
          if (error == null) {
            log.info("Cloud drive connected");
          } else {
            log.warn("Cloud drive connection not completed: {}", error.getMessage());
          }
        });
  }
}
