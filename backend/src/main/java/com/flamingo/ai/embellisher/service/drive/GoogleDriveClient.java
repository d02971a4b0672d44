package com.flamingo.ai.embellisher.service.drive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import io.github.resilience4j.retry.annotation.Retry;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for Google OAuth token endpoints and the Drive v3 upload API. Uses plain WebClient
 * calls; errors propagate as WebClient exceptions.
 */
@Component
@Slf4j
public class GoogleDriveClient {

  private static final Duration TIMEOUT = Duration.ofSeconds(60);
  private static final String UPLOAD_FIELDS = "id,name,webViewLink,webContentLink";

  private final WebClient webClient;
  private final EmbellisherProperties.Drive config;

  public GoogleDriveClient(EmbellisherProperties properties) {
    this.config = properties.getDrive();
    this.webClient =
        WebClient.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
  }

  /** Exchanges an authorization code for tokens. */
  @Retry(name = "drive")
  public TokenResponse exchangeCode(String code) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("code", code);
    form.add("client_id", config.getClientId());
    form.add("client_secret", config.getClientSecret());
    form.add("redirect_uri", config.getRedirectUri());
    form.add("grant_type", "authorization_code");
    return postTokenForm(form);
  }

  /** Obtains a fresh access token from a refresh token. */
  @Retry(name = "drive")
  public TokenResponse refresh(String refreshToken) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("refresh_token", refreshToken);
    form.add("client_id", config.getClientId());
    form.add("client_secret", config.getClientSecret());
    form.add("grant_type", "refresh_token");
    return postTokenForm(form);
  }

  /**
   * Uploads a file with a multipart (metadata + media) request.
   *
   * @param folderId parent folder, or null for the drive root
   */
  @Retry(name = "drive")
  public DriveFile upload(
      String accessToken,
      String fileName,
      String mediaType,
      String description,
      String folderId,
      byte[] content) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("name", fileName);
    metadata.put("mimeType", MediaType.parseMediaType(mediaType).toString());
    metadata.put("description", description);
    if (folderId != null && !folderId.isBlank()) {
      metadata.put("parents", new String[] {folderId});
    }

    MultipartBodyBuilder body = new MultipartBodyBuilder();
    body.part("metadata", metadata, MediaType.APPLICATION_JSON);
    body.part("file", content, MediaType.parseMediaType(mediaType));

    DriveFile file =
        webClient
            .post()
            .uri(
                config.getApiBaseUrl()
                    + "/upload/drive/v3/files?uploadType=multipart&fields="
                    + UPLOAD_FIELDS)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
            .contentType(MediaType.MULTIPART_RELATED)
            .body(BodyInserters.fromMultipartData(body.build()))
            .retrieve()
            .bodyToMono(DriveFile.class)
            .timeout(TIMEOUT)
            .block();
    log.debug("Uploaded {} to drive as {}", fileName, file != null ? file.id() : null);
    return file;
  }

  private TokenResponse postTokenForm(MultiValueMap<String, String> form) {
    return webClient
        .post()
        .uri(config.getTokenUri())
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .body(BodyInserters.fromFormData(form))
        .retrieve()
        .bodyToMono(TokenResponse.class)
        .timeout(TIMEOUT)
        .block();
  }

  /** OAuth token endpoint response. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record TokenResponse(
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("refresh_token") String refreshToken,
      @JsonProperty("expires_in") Long expiresIn) {}

  /** Drive file resource, limited to the requested fields. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DriveFile(String id, String name, String webViewLink, String webContentLink) {}
}
