package com.flamingo.ai.embellisher.service.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import com.flamingo.ai.embellisher.domain.enums.InputType;
import com.flamingo.ai.embellisher.domain.repository.NoteRepository;
import com.flamingo.ai.embellisher.exception.NoteNotFoundException;
import com.flamingo.ai.embellisher.exception.NoteNotReadyException;
import com.flamingo.ai.embellisher.service.export.storage.ArtifactStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ArtifactExportServiceTest {

  private static final String OWNER = "user-1";

  @Mock private NoteRepository noteRepository;

  @Mock private ArtifactStorage artifactStorage;

  @Mock private PlatformTransactionManager transactionManager;

  private CountingConverter txtConverter;
  private ArtifactExportService exportService;
  private ExecutorService executor;
  private Note note;

  @BeforeEach
  void setUp() {
    txtConverter = new CountingConverter();
    exportService =
        new ArtifactExportService(
            noteRepository,
            List.of(txtConverter),
            artifactStorage,
            new SimpleMeterRegistry(),
            transactionManager);
    executor = Executors.newFixedThreadPool(2);

    note =
        Note.builder()
            .id(UUID.randomUUID())
            .ownerId(OWNER)
            .inputType(InputType.TEXT)
            .originalText("Mitosis")
            .build();
    when(noteRepository.findByIdAndOwnerId(note.getId(), OWNER)).thenReturn(Optional.of(note));
    when(noteRepository.findById(note.getId())).thenReturn(Optional.of(note));
    when(noteRepository.saveAndFlush(any(Note.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    when(artifactStorage.store(eq(note.getId()), eq(ExportFormat.TXT), anyString(), any()))
        .thenReturn("http://localhost:8080/files/" + note.getId() + "/notes-1a2b3c4d.txt");
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private void complete() {
    note.startProcessing("start");
    note.markCompleted("# Mitosis");
  }

  @Test
  @DisplayName("should generate, store and record the artifact location")
  void shouldGenerateArtifact() {
    complete();

    String location = exportService.generate(OWNER, note.getId(), ExportFormat.TXT);

    assertThat(location).endsWith(".txt");
    assertThat(note.getTxtLocation()).isEqualTo(location);
    verify(noteRepository).saveAndFlush(note);
  }

  @Test
  @DisplayName("should return the recorded location without converting again")
  void shouldBeIdempotent() {
    complete();

    String first = exportService.generate(OWNER, note.getId(), ExportFormat.TXT);
    String second = exportService.generate(OWNER, note.getId(), ExportFormat.TXT);

    assertThat(second).isEqualTo(first);
    assertThat(txtConverter.calls.get()).isEqualTo(1);
    verify(artifactStorage, times(1)).store(any(), any(), anyString(), any());
  }

  @Test
  @DisplayName("should convert once when two callers race for the same format")
  void shouldCollapseConcurrentRequests() throws Exception {
    complete();
    txtConverter.delayMillis = 200;
    Callable<String> request = () -> exportService.generate(OWNER, note.getId(), ExportFormat.TXT);

    Future<String> first = executor.submit(request);
    Future<String> second = executor.submit(request);

    assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(second.get(5, TimeUnit.SECONDS));
    assertThat(txtConverter.calls.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("should reject export of a note that is still processing")
  void shouldRejectNotReadyNote() {
    note.startProcessing("start");

    assertThatThrownBy(() -> exportService.generate(OWNER, note.getId(), ExportFormat.TXT))
        .isInstanceOf(NoteNotReadyException.class);
    assertThat(txtConverter.calls.get()).isZero();
    verify(artifactStorage, never()).store(any(), any(), anyString(), any());
  }

  @Test
  @DisplayName("should not expose another user's note")
  void shouldRejectForeignNote() {
    complete();
    when(noteRepository.findByIdAndOwnerId(note.getId(), "intruder")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> exportService.generate("intruder", note.getId(), ExportFormat.TXT))
        .isInstanceOf(NoteNotFoundException.class);
  }

  @Test
  @DisplayName("should load stored bytes, generating first when needed")
  void shouldLoadContent() {
    complete();
    when(artifactStorage.load(anyString())).thenReturn("# Mitosis".getBytes());

    byte[] content = exportService.loadContent(OWNER, note.getId(), ExportFormat.TXT);

    assertThat(new String(content)).isEqualTo("# Mitosis");
    assertThat(txtConverter.calls.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("should record the location on a freshly read note, keeping its other artifacts")
  void shouldRecordAgainstFreshNote() {
    // Given
    complete();
    Note fresh =
        Note.builder()
            .id(note.getId())
            .ownerId(OWNER)
            .inputType(InputType.TEXT)
            .originalText("Mitosis")
            .build();
    fresh.startProcessing("start");
    fresh.markCompleted("# Mitosis");
    fresh.recordArtifact(ExportFormat.DOCX, "http://localhost:8080/files/x/notes-docx.docx");
    when(noteRepository.findById(note.getId())).thenReturn(Optional.of(fresh));

    // When
    String location = exportService.generate(OWNER, note.getId(), ExportFormat.TXT);

    // Then
    assertThat(fresh.getTxtLocation()).isEqualTo(location);
    assertThat(fresh.getDocxLocation()).endsWith("notes-docx.docx");
    verify(noteRepository).saveAndFlush(fresh);
    verify(noteRepository, never()).saveAndFlush(note);
    verify(noteRepository, never()).save(any(Note.class));
  }

  @Test
  @DisplayName("should discard the artifact when the note is deleted during conversion")
  void shouldFail_whenNoteDeletedDuringConversion() {
    // Given
    complete();
    when(noteRepository.findById(note.getId())).thenReturn(Optional.empty());

    // When / Then
    assertThatThrownBy(() -> exportService.generate(OWNER, note.getId(), ExportFormat.TXT))
        .isInstanceOf(NoteNotFoundException.class);
    verify(artifactStorage).deleteAll(note.getId());
    verify(noteRepository, never()).saveAndFlush(any(Note.class));
  }

  @Test
  @DisplayName("should drop per-format locks once no caller holds them")
  void shouldReleaseLocks_afterGeneration() throws Exception {
    // Given
    complete();
    txtConverter.delayMillis = 100;
    Callable<String> request = () -> exportService.generate(OWNER, note.getId(), ExportFormat.TXT);

    // When
    Future<String> first = executor.submit(request);
    Future<String> second = executor.submit(request);
    first.get(5, TimeUnit.SECONDS);
    second.get(5, TimeUnit.SECONDS);
    assertThatThrownBy(() -> exportService.generate("intruder", note.getId(), ExportFormat.TXT))
        .isInstanceOf(NoteNotFoundException.class);

    // Then
    assertThat(exportService.activeLockCount()).isZero();
  }

  private static final class CountingConverter implements ArtifactConverter {

    private final AtomicInteger calls = new AtomicInteger();
    private volatile long delayMillis;

    @Override
    public boolean supports(ExportFormat format) {
      return format == ExportFormat.TXT;
    }

    @Override
    public byte[] convert(Note note) {
      calls.incrementAndGet();
      if (delayMillis > 0) {
        try {
          Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      return note.getEnhancedContent().getBytes();
    }
  }
}
