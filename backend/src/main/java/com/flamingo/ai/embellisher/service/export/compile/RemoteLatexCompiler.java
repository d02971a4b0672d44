package com.flamingo.ai.embellisher.service.export.compile;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.exception.CompilationException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Compiles through the remote build service.
 *
 * <p>The service only accepts CRLF line endings, so the source is normalized before sending. A 4xx
 * answer means the service compiled and rejected the markup; connection failures, timeouts, 5xx
 * answers and an open circuit mean it is unavailable.
 */
@Component
@Order(2)
@Slf4j
public class RemoteLatexCompiler implements LatexCompiler {

  private final RemoteLatexClient client;
  private final EmbellisherProperties.Compilation.Remote config;

  public RemoteLatexCompiler(RemoteLatexClient client, EmbellisherProperties properties) {
    this.client = client;
    this.config = properties.getCompilation().getRemote();
  }

  @Override
  public String name() {
    return "remote";
  }

  @Override
  public boolean isEnabled() {
    return config.isEnabled();
  }

  @Override
  public byte[] compile(String latex) {
    String payload = normalizeLineEndings(latex, config.getLineEnding());
    try {
      byte[] pdf = client.compile(payload);
      if (pdf == null || pdf.length == 0) {
        throw CompilationException.unavailable("Remote compiler returned an empty document", null);
      }
      return pdf;
    } catch (WebClientResponseException e) {
      if (e.getStatusCode().is4xxClientError()) {
        throw CompilationException.rejected(
            "Remote compiler rejected the document (" + e.getStatusCode().value() + ")",
            e.getResponseBodyAsString());
      }
      throw CompilationException.unavailable(
          "Remote compiler failed with " + e.getStatusCode().value(), e);
    } catch (CallNotPermittedException e) {
      throw CompilationException.unavailable("Remote compiler circuit is open", e);
    } catch (CompilationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw CompilationException.unavailable("Remote compiler unreachable: " + e.getMessage(), e);
    }
  }

  /**
   * Rewrites every line terminator ({@code \r\n}, lone {@code \r}, lone {@code \n}) to the given
   * convention: {@code CRLF} or {@code LF}.
   */
  static String normalizeLineEndings(String text, String convention) {
    String lf = text.replace("\r\n", "\n").replace('\r', '\n');
    return "LF".equalsIgnoreCase(convention) ? lf : lf.replace("\n", "\r\n");
  }
}
