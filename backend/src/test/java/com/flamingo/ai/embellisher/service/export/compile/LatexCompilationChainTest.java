package com.flamingo.ai.embellisher.service.export.compile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.embellisher.exception.CompilationException;
import com.flamingo.ai.embellisher.exception.CompilationException.Kind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LatexCompilationChain")
class LatexCompilationChainTest {

  private static final byte[] PDF = "%PDF-1.4".getBytes();

  private LatexCompiler local;
  private LatexCompiler remote;
  private SimpleMeterRegistry meterRegistry;
  private LatexCompilationChain chain;

  @BeforeEach
  void setUp() {
    local = compiler("local");
    remote = compiler("remote");
    meterRegistry = new SimpleMeterRegistry();
    chain = new LatexCompilationChain(List.of(local, remote), meterRegistry);
  }

  private static LatexCompiler compiler(String name) {
    LatexCompiler compiler = mock(LatexCompiler.class);
    when(compiler.name()).thenReturn(name);
    when(compiler.isEnabled()).thenReturn(true);
    return compiler;
  }

  @Test
  void shouldUseLocalCompiler_whenItSucceeds() {
    // Given
    when(local.compile(anyString())).thenReturn(PDF);

    // When
    byte[] pdf = chain.compile("\\documentclass{article}");

    // Then
    assertThat(pdf).isEqualTo(PDF);
    verify(remote, never()).compile(anyString());
    assertThat(meterRegistry.counter("export.compile.success", "compiler", "local").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldFallBackToRemote_whenLocalIsUnavailable() {
    // Given
    when(local.compile(anyString()))
        .thenThrow(CompilationException.unavailable("pdflatex is not installed", null));
    when(remote.compile(anyString())).thenReturn(PDF);

    // When
    byte[] pdf = chain.compile("source");

    // Then
    assertThat(pdf).isEqualTo(PDF);
    assertThat(
            meterRegistry
                .counter(
                    "export.compile.failure", "compiler", "local", "kind", "COMPILER_UNAVAILABLE")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldFallBackToRemote_whenLocalRejectsMarkup() {
    // Given
    when(local.compile(anyString()))
        .thenThrow(CompilationException.rejected("exit 1", "! Undefined control sequence."));
    when(remote.compile(anyString())).thenReturn(PDF);

    // When / Then
    assertThat(chain.compile("source")).isEqualTo(PDF);
  }

  @Test
  void shouldSkipDisabledCompilers() {
    // Given
    when(local.isEnabled()).thenReturn(false);
    when(remote.compile(anyString())).thenReturn(PDF);

    // When
    chain.compile("source");

    // Then
    verify(local, never()).compile(anyString());
  }

  @Test
  void shouldReportRejection_whenAnyCompilerRejected() {
    // Given
    when(local.compile(anyString()))
        .thenThrow(CompilationException.rejected("exit 1", "! Missing $ inserted."));
    when(remote.compile(anyString()))
        .thenThrow(CompilationException.unavailable("connection refused", null));

    // When / Then
    assertThatThrownBy(() -> chain.compile("source"))
        .isInstanceOf(CompilationException.class)
        .satisfies(
            e -> {
              CompilationException ce = (CompilationException) e;
              assertThat(ce.getKind()).isEqualTo(Kind.MARKUP_REJECTED);
              assertThat(ce.getCompilerLog()).isEqualTo("! Missing $ inserted.");
            });
  }

  @Test
  void shouldReportUnavailable_whenNoCompilerCouldRun() {
    // Given
    when(local.compile(anyString()))
        .thenThrow(CompilationException.unavailable("not installed", null));
    when(remote.compile(anyString()))
        .thenThrow(CompilationException.unavailable("timeout", null));

    // When / Then
    assertThatThrownBy(() -> chain.compile("source"))
        .isInstanceOf(CompilationException.class)
        .extracting(e -> ((CompilationException) e).getKind())
        .isEqualTo(Kind.COMPILER_UNAVAILABLE);
  }

  @Test
  void shouldReportUnavailable_whenAllCompilersDisabled() {
    // Given
    when(local.isEnabled()).thenReturn(false);
    when(remote.isEnabled()).thenReturn(false);

    // When / Then
    assertThatThrownBy(() -> chain.compile("source"))
        .isInstanceOf(CompilationException.class)
        .hasMessageContaining("No LaTeX compiler is available");
  }
}
