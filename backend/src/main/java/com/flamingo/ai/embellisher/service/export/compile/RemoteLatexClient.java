package com.flamingo.ai.embellisher.service.export.compile;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for a remote LaTeX build service exposing {@code POST /builds/sync}. Encapsulates
 * all WebClient communication; errors propagate as WebClient exceptions.
 */
@Component
@Slf4j
public class RemoteLatexClient {

  private final WebClient webClient;
  private final Duration timeout;

  public RemoteLatexClient(EmbellisherProperties properties) {
    EmbellisherProperties.Compilation.Remote remote = properties.getCompilation().getRemote();
    this.timeout = Duration.ofSeconds(remote.getTimeoutSeconds());
    this.webClient =
        WebClient.builder()
            .baseUrl(remote.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
            .build();
    log.info("Remote LaTeX client initialized: baseUrl={}", remote.getBaseUrl());
  }

  /**
   * Compiles a single-file document with pdflatex.
   *
   * @param latex document source, already in the service's line ending convention
   * @return PDF bytes
   */
  @CircuitBreaker(name = "remoteLatex")
  public byte[] compile(String latex) {
    var request = new BuildRequest("pdflatex", List.of(new Resource(true, latex)));
    return webClient
        .post()
        .uri("/builds/sync")
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_PDF)
        .bodyValue(request)
        .retrieve()
        .bodyToMono(byte[].class)
        .timeout(timeout)
        .block();
  }

  record BuildRequest(String compiler, List<Resource> resources) {}

  record Resource(boolean main, String content) {}
}
