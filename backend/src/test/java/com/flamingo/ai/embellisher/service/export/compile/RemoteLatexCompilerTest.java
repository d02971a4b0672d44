package com.flamingo.ai.embellisher.service.export.compile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.exception.CompilationException;
import com.flamingo.ai.embellisher.exception.CompilationException.Kind;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RemoteLatexCompiler")
class RemoteLatexCompilerTest {

  @Mock private RemoteLatexClient client;

  private EmbellisherProperties properties;
  private RemoteLatexCompiler compiler;

  @BeforeEach
  void setUp() {
    properties = new EmbellisherProperties();
    compiler = new RemoteLatexCompiler(client, properties);
  }

  private static WebClientResponseException httpError(int status, String body) {
    return WebClientResponseException.create(
        status, "error", HttpHeaders.EMPTY, body.getBytes(StandardCharsets.UTF_8), null);
  }

  private static Kind kindOf(Throwable e) {
    return ((CompilationException) e).getKind();
  }

  @Test
  void shouldSendCrlfSource_andReturnPdf() {
    // Given
    when(client.compile(anyString())).thenReturn(new byte[] {1, 2, 3});

    // When
    byte[] pdf = compiler.compile("\\begin{document}\nHi\r\n\\end{document}\r");

    // Then
    assertThat(pdf).containsExactly(1, 2, 3);
    verify(client).compile("\\begin{document}\r\nHi\r\n\\end{document}\r\n");
  }

  @Test
  void shouldSendLfSource_whenConfigured() {
    // Given
    properties.getCompilation().getRemote().setLineEnding("LF");
    compiler = new RemoteLatexCompiler(client, properties);
    when(client.compile(anyString())).thenReturn(new byte[] {1});

    // When
    compiler.compile("a\r\nb\rc");

    // Then
    verify(client).compile("a\nb\nc");
  }

  @Nested
  @DisplayName("Failure classification")
  class FailureClassification {

    @Test
    void shouldReportRejection_whenServiceAnswers4xx() {
      when(client.compile(anyString())).thenThrow(httpError(400, "! Undefined control sequence."));

      assertThatThrownBy(() -> compiler.compile("x"))
          .isInstanceOf(CompilationException.class)
          .satisfies(
              e -> {
                assertThat(kindOf(e)).isEqualTo(Kind.MARKUP_REJECTED);
                assertThat(((CompilationException) e).getCompilerLog())
                    .isEqualTo("! Undefined control sequence.");
              });
    }

    @Test
    void shouldReportUnavailable_whenServiceAnswers5xx() {
      when(client.compile(anyString())).thenThrow(httpError(503, "maintenance"));

      assertThatThrownBy(() -> compiler.compile("x"))
          .satisfies(e -> assertThat(kindOf(e)).isEqualTo(Kind.COMPILER_UNAVAILABLE));
    }

    @Test
    void shouldReportUnavailable_whenConnectionFails() {
      when(client.compile(anyString()))
          .thenThrow(
              new WebClientRequestException(
                  new ConnectException("Connection refused"),
                  HttpMethod.POST,
                  URI.create("https://latex.example/builds/sync"),
                  HttpHeaders.EMPTY));

      assertThatThrownBy(() -> compiler.compile("x"))
          .satisfies(e -> assertThat(kindOf(e)).isEqualTo(Kind.COMPILER_UNAVAILABLE));
    }

    @Test
    void shouldReportUnavailable_whenCircuitIsOpen() {
      when(client.compile(anyString()))
          .thenThrow(
              CallNotPermittedException.createCallNotPermittedException(
                  CircuitBreaker.ofDefaults("remoteLatex")));

      assertThatThrownBy(() -> compiler.compile("x"))
          .satisfies(e -> assertThat(kindOf(e)).isEqualTo(Kind.COMPILER_UNAVAILABLE));
    }

    @Test
    void shouldReportUnavailable_whenResponseIsEmpty() {
      when(client.compile(anyString())).thenReturn(new byte[0]);

      assertThatThrownBy(() -> compiler.compile("x"))
          .satisfies(e -> assertThat(kindOf(e)).isEqualTo(Kind.COMPILER_UNAVAILABLE));
    }
  }
}
