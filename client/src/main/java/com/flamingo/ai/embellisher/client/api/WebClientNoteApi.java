package com.flamingo.ai.embellisher.client.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flamingo.ai.embellisher.client.model.ArtifactReference;
import com.flamingo.ai.embellisher.client.model.DriveAuthorization;
import com.flamingo.ai.embellisher.client.model.DriveStatus;
import com.flamingo.ai.embellisher.client.model.DriveUpload;
import com.flamingo.ai.embellisher.client.model.ExportFormat;
import com.flamingo.ai.embellisher.client.model.NoteSettings;
import com.flamingo.ai.embellisher.client.model.NoteView;
import com.flamingo.ai.embellisher.client.model.UploadFile;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** {@link NoteApi} over HTTP using Spring WebClient. */
@Slf4j
public class WebClientNoteApi implements NoteApi {

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);
  private static final Duration EXPORT_TIMEOUT = Duration.ofSeconds(180);

  private final WebClient webClient;
  private final ObjectMapper objectMapper;

  /**
   * @param baseUrl server root, e.g. {@code http://localhost:8080}
   * @param tokenSupplier current bearer token; called for every request
   */
  public WebClientNoteApi(String baseUrl, Supplier<String> tokenSupplier) {
    this(WebClient.builder().baseUrl(baseUrl), tokenSupplier);
  }

  public WebClientNoteApi(WebClient.Builder builder, Supplier<String> tokenSupplier) {
    this.objectMapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.webClient =
        builder
            .codecs(
                configurer -> {
                  configurer
                      .defaultCodecs()
                      .jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
                  configurer
                      .defaultCodecs()
                      .jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
                })
            .filter(bearerToken(tokenSupplier))
            .build();
  }

  @Override
  public CompletableFuture<NoteView> createTextNote(String text, NoteSettings settings) {
    return webClient
        .post()
        .uri("/api/notes")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("text", text, "settings", settings))
        .retrieve()
        .onStatus(HttpStatusCode::isError, this::toException)
        .bodyToMono(NoteView.class)
        .timeout(REQUEST_TIMEOUT)
        .toFuture();
  }

  @Override
  public CompletableFuture<NoteView> createSingleImageNote(UploadFile file, NoteSettings settings) {
    MultipartBodyBuilder body = new MultipartBodyBuilder();
    addFilePart(body, "file", file);
    body.part("settings", settings, MediaType.APPLICATION_JSON);
    return postMultipart("/api/notes/image", body);
  }

  @Override
  public CompletableFuture<NoteView> createMultiImageNote(
      List<UploadFile> files, NoteSettings settings) {
    MultipartBodyBuilder body = new MultipartBodyBuilder();
    for (UploadFile file : files) {
      addFilePart(body, "files", file);
    }
    body.part("settings", settings, MediaType.APPLICATION_JSON);
    return postMultipart("/api/notes/images", body);
  }

  @Override
  public CompletableFuture<NoteView> getNote(UUID noteId) {
    return webClient
        .get()
        .uri("/api/notes/{id}", noteId)
        .retrieve()
        .onStatus(HttpStatusCode::isError, this::toException)
        .bodyToMono(NoteView.class)
        .timeout(REQUEST_TIMEOUT)
        .toFuture();
  }

  @Override
  public CompletableFuture<ArtifactReference> generateArtifact(UUID noteId, ExportFormat format) {
    return webClient
        .post()
        .uri("/api/notes/{id}/artifacts/{format}", noteId, format.value())
        .retrieve()
        .onStatus(HttpStatusCode::isError, this::toException)
        .bodyToMono(ArtifactReference.class)
        .timeout(EXPORT_TIMEOUT)
        .toFuture();
  }

  @Override
  public CompletableFuture<List<String>> previewTopics(String text) {
    return webClient
        .post()
        .uri("/api/topics/preview")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("text", text))
        .retrieve()
        .onStatus(HttpStatusCode::isError, this::toException)
        .bodyToMono(TopicsBody.class)
        .map(body -> body.topics() == null ? List.<String>of() : body.topics())
        .timeout(REQUEST_TIMEOUT)
        .toFuture();
  }

  @Override
  public CompletableFuture<DriveStatus> driveStatus() {
    return webClient
        .get()
        .uri("/api/drive/status")
        .retrieve()
        .onStatus(HttpStatusCode::isError, this::toException)
        .bodyToMono(DriveStatus.class)
        .timeout(REQUEST_TIMEOUT)
        .toFuture();
  }

  @Override
  public CompletableFuture<DriveAuthorization> driveAuthorizationUrl() {
    return webClient
        .get()
        .uri("/api/drive/auth-url")
        .retrieve()
        .onStatus(HttpStatusCode::isError, this::toException)
        .bodyToMono(DriveAuthorization.class)
        .timeout(REQUEST_TIMEOUT)
        .toFuture();
  }

  @Override
  public CompletableFuture<DriveUpload> uploadToDrive(UUID noteId, ExportFormat format) {
    return webClient
        .post()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path("/api/notes/{id}/drive-upload")
                    .queryParam("format", format.value())
                    .build(noteId))
        .retrieve()
        .onStatus(HttpStatusCode::isError, this::toException)
        .bodyToMono(DriveUpload.class)
        .timeout(EXPORT_TIMEOUT)
        .toFuture();
  }

  private CompletableFuture<NoteView> postMultipart(String path, MultipartBodyBuilder body) {
    return webClient
        .post()
        .uri(path)
        .contentType(MediaType.MULTIPART_FORM_DATA)
        .body(BodyInserters.fromMultipartData(body.build()))
        .retrieve()
        .onStatus(HttpStatusCode::isError, this::toException)
        .bodyToMono(NoteView.class)
        .timeout(REQUEST_TIMEOUT)
        .toFuture();
  }

  private static void addFilePart(MultipartBodyBuilder body, String name, UploadFile file) {
    body.part(name, file.content())
        .filename(file.name())
        .contentType(
            file.mediaType() == null
                ? MediaType.APPLICATION_OCTET_STREAM
                : MediaType.parseMediaType(file.mediaType()));
  }

  private Mono<? extends Throwable> toException(ClientResponse response) {
    int status = response.statusCode().value();
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(raw -> mapError(status, raw));
  }

  ApiException mapError(int status, String rawBody) {
    ErrorBody body = parseErrorBody(rawBody);
    String message =
        body.message() != null ? body.message() : "Request failed with status " + status;
    log.debug("Note service returned {} [{}]: {}", status, body.errorId(), message);
    if (status == HttpStatus.UNAUTHORIZED.value()) {
      return new AuthorizationException(body.code(), message, body.errorId());
    }
    if (status == HttpStatus.CONFLICT.value()
        && DriveNotConnectedException.CODE.equals(body.code())) {
      return new DriveNotConnectedException(message, body.errorId());
    }
    return new ApiException(status, body.code(), message, body.errorId());
  }

  private ErrorBody parseErrorBody(String rawBody) {
    if (rawBody == null || rawBody.isBlank()) {
      return new ErrorBody(null, null, null);
    }
    try {
      return objectMapper.readValue(rawBody, ErrorBody.class);
    } catch (IOException e) {
      log.debug("Error response is not JSON: {}", e.getMessage());
      return new ErrorBody(null, null, null);
    }
  }

  private static ExchangeFilterFunction bearerToken(Supplier<String> tokenSupplier) {
    return (request, next) -> {
      String token = tokenSupplier.get();
      if (token == null || token.isBlank()) {
        return next.exchange(request);
      }
      return next.exchange(
          ClientRequest.from(request)
              .headers(headers -> headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + token))
              .build());
    };
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ErrorBody(String errorId, String code, String message) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TopicsBody(List<String> topics) {}
}
