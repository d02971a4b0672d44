package com.flamingo.ai.embellisher.api.rest;

import com.flamingo.ai.embellisher.api.dto.request.CreateTextNoteRequest;
import com.flamingo.ai.embellisher.api.dto.request.UpdateMetadataRequest;
import com.flamingo.ai.embellisher.api.dto.response.ArtifactResponse;
import com.flamingo.ai.embellisher.api.dto.response.NoteResponse;
import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import com.flamingo.ai.embellisher.security.AuthenticatedUser;
import com.flamingo.ai.embellisher.security.BearerTokenInterceptor;
import com.flamingo.ai.embellisher.service.export.ArtifactExportService;
import com.flamingo.ai.embellisher.service.note.NoteService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for note submission, status and export. */
@RestController
@RequestMapping("/api/notes")
@RequiredArgsConstructor
public class NoteController {

  private final NoteService noteService;
  private final ArtifactExportService exportService;

  /** Submits typed text. Processing continues in the background. */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<NoteResponse> createTextNote(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user,
      @Valid @RequestBody CreateTextNoteRequest request) {
    Note note = noteService.createTextNote(user.userId(), request.getText(), request.getSettings());
    return ResponseEntity.status(HttpStatus.CREATED).body(NoteResponse.fromEntity(note));
  }

  /** Submits a single image or PDF page. */
  @PostMapping(value = "/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<NoteResponse> createImageNote(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user,
      @RequestPart("file") MultipartFile file,
      @Valid @RequestPart("settings") ProcessingSettings settings) {
    Note note = noteService.createSingleImageNote(user.userId(), file, settings);
    return ResponseEntity.status(HttpStatus.CREATED).body(NoteResponse.fromEntity(note));
  }

  /** Submits 2 to 5 pages that are read as one document. */
  @PostMapping(value = "/images", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<NoteResponse> createMultiImageNote(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user,
      @RequestPart("files") List<MultipartFile> files,
      @Valid @RequestPart("settings") ProcessingSettings settings) {
    Note note = noteService.createMultiImageNote(user.userId(), files, settings);
    return ResponseEntity.status(HttpStatus.CREATED).body(NoteResponse.fromEntity(note));
  }

  /** Lists the caller's notes, newest first. */
  @GetMapping
  public ResponseEntity<List<NoteResponse>> listNotes(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user) {
    List<NoteResponse> notes =
        noteService.listNotes(user.userId()).stream().map(NoteResponse::summaryOf).toList();
    return ResponseEntity.ok(notes);
  }

  /** Gets a note with its progress, content, artifacts and flashcards. */
  @GetMapping("/{noteId}")
  public ResponseEntity<NoteResponse> getNote(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user,
      @PathVariable UUID noteId) {
    return ResponseEntity.ok(NoteResponse.fromEntity(noteService.getNote(user.userId(), noteId)));
  }

  @PatchMapping("/{noteId}/metadata")
  public ResponseEntity<NoteResponse> updateMetadata(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user,
      @PathVariable UUID noteId,
      @Valid @RequestBody UpdateMetadataRequest request) {
    Note note = noteService.updateMetadata(user.userId(), noteId, request.toMetadata());
    return ResponseEntity.ok(NoteResponse.fromEntity(note));
  }

  @DeleteMapping("/{noteId}")
  public ResponseEntity<Void> deleteNote(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user,
      @PathVariable UUID noteId) {
    noteService.deleteNote(user.userId(), noteId);
    return ResponseEntity.noContent().build();
  }

  /** Generates an export artifact, or returns the one already stored. */
  @PostMapping("/{noteId}/artifacts/{format}")
  public ResponseEntity<ArtifactResponse> generateArtifact(
      @RequestAttribute(BearerTokenInterceptor.USER_ATTRIBUTE) AuthenticatedUser user,
      @PathVariable UUID noteId,
      @PathVariable String format) {
    ExportFormat exportFormat = ExportFormat.fromValue(format);
    String location = exportService.generate(user.userId(), noteId, exportFormat);
    return ResponseEntity.ok(new ArtifactResponse(exportFormat.getExtension(), location));
  }
}
