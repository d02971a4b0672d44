package com.flamingo.ai.embellisher.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(NoteNotFoundException.class)
  public ResponseEntity<ApiError> handleNoteNotFound(
      NoteNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("note_not_found");
    String errorId = generateErrorId();
    log.warn("Note not found [{}]: {}", errorId, ex.getNoteId());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.NOTE_NOT_FOUND, "Note not found", request);
  }

  @ExceptionHandler(NoteNotReadyException.class)
  public ResponseEntity<ApiError> handleNoteNotReady(
      NoteNotReadyException ex, HttpServletRequest request) {

    incrementErrorCounter("note_not_ready");
    String errorId = generateErrorId();
    log.warn(
        "Export requested too early [{}]: note={}, status={}",
        errorId,
        ex.getNoteId(),
        ex.getStatus());

    return build(
        HttpStatus.CONFLICT, errorId, ApiError.NOTE_NOT_READY, ex.getUserMessage(), request);
  }

  @ExceptionHandler(InvalidNoteTransitionException.class)
  public ResponseEntity<ApiError> handleInvalidTransition(
      InvalidNoteTransitionException ex, HttpServletRequest request) {

    incrementErrorCounter("note_invalid_transition");
    String errorId = generateErrorId();
    log.warn("Invalid note transition [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.NOTE_INVALID_TRANSITION,
        "The note is not in a state that allows this operation",
        request);
  }

  @ExceptionHandler(InputValidationException.class)
  public ResponseEntity<ApiError> handleInputValidation(
      InputValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("input_rejected");
    String errorId = generateErrorId();
    log.warn("Input rejected [{}]: {} - {}", errorId, ex.getReason(), ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INPUT_REJECTED)
                .message(ex.getMessage())
                .details(ex.getReason().name())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(CompilationException.class)
  public ResponseEntity<ApiError> handleCompilation(
      CompilationException ex, HttpServletRequest request) {

    String errorId = generateErrorId();
    if (ex.isMarkupRejected()) {
      incrementErrorCounter("markup_rejected");
      log.warn("Markup rejected by compiler [{}]: {}", errorId, ex.getMessage());
    } else {
      incrementErrorCounter("compiler_unavailable");
      log.error("No compiler available [{}]: {}", errorId, ex.getMessage(), ex);
    }

    HttpStatus status =
        ex.isMarkupRejected() ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.SERVICE_UNAVAILABLE;
    String code = ex.isMarkupRejected() ? ApiError.MARKUP_REJECTED : ApiError.COMPILER_UNAVAILABLE;

    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(ex.getUserMessage())
                .details(ex.getCompilerLog())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DriveNotConnectedException.class)
  public ResponseEntity<ApiError> handleDriveNotConnected(
      DriveNotConnectedException ex, HttpServletRequest request) {

    incrementErrorCounter("drive_not_connected");
    String errorId = generateErrorId();
    log.info("Drive not connected [{}]: owner={}", errorId, ex.getOwnerId());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.DRIVE_NOT_CONNECTED,
        "Cloud drive is not connected. Connect your account and try again.",
        request);
  }

  @ExceptionHandler(DriveProviderException.class)
  public ResponseEntity<ApiError> handleDriveProvider(
      DriveProviderException ex, HttpServletRequest request) {

    incrementErrorCounter("drive_provider_error");
    String errorId = generateErrorId();
    log.error("Drive provider error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.DRIVE_PROVIDER_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;

    return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(UnauthorizedException.class)
  public ResponseEntity<ApiError> handleUnauthorized(
      UnauthorizedException ex, HttpServletRequest request) {

    incrementErrorCounter("unauthorized");
    String errorId = generateErrorId();
    log.debug("Unauthorized request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNAUTHORIZED,
        errorId,
        ApiError.AUTH_REQUIRED,
        "Authentication required. Please sign in again.",
        request);
  }

  @ExceptionHandler(ArtifactStorageException.class)
  public ResponseEntity<ApiError> handleStorage(
      ArtifactStorageException ex, HttpServletRequest request) {

    incrementErrorCounter("storage_error");
    String errorId = generateErrorId();
    log.error("Artifact storage error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.STORAGE_ERROR,
        "The exported file could not be stored. Please try again.",
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getAllErrors().stream()
            .findFirst()
            .map(
                error ->
                    error instanceof FieldError fieldError
                        ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                        : error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("bad_request");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("input_rejected");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INPUT_REJECTED)
                .message("Each file must be 10 MB or smaller")
                .details(InputValidationException.Reason.FILE_TOO_LARGE.name())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
