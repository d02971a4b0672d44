package com.flamingo.ai.embellisher.service.export.compile;

import com.flamingo.ai.embellisher.exception.CompilationException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Tries each enabled {@link LatexCompiler} in order until one produces a PDF.
 *
 * <p>When all fail, the raised {@link CompilationException} is MARKUP_REJECTED if any compiler
 * rejected the source (carrying that compiler's log), otherwise COMPILER_UNAVAILABLE.
 */
@Service
@Slf4j
public class LatexCompilationChain {

  private final List<LatexCompiler> compilers;
  private final MeterRegistry meterRegistry;

  public LatexCompilationChain(List<LatexCompiler> compilers, MeterRegistry meterRegistry) {
    this.compilers = compilers;
    this.meterRegistry = meterRegistry;
  }

  @Timed(value = "export.compile", description = "Time to compile LaTeX to PDF")
  public byte[] compile(String latex) {
    CompilationException rejection = null;
    CompilationException lastFailure = null;

    for (LatexCompiler compiler : compilers) {
      if (!compiler.isEnabled()) {
        continue;
      }
      try {
        byte[] pdf = compiler.compile(latex);
        meterRegistry.counter("export.compile.success", "compiler", compiler.name()).increment();
        log.info("Compiled PDF with {} compiler ({} bytes)", compiler.name(), pdf.length);
        return pdf;
      } catch (CompilationException e) {
        meterRegistry
            .counter(
                "export.compile.failure", "compiler", compiler.name(), "kind", e.getKind().name())
            .increment();
        log.warn("{} compiler failed ({}): {}", compiler.name(), e.getKind(), e.getMessage());
        lastFailure = e;
        if (e.isMarkupRejected() && rejection == null) {
          rejection = e;
        }
      }
    }

    if (rejection != null) {
      throw CompilationException.rejected(
          "The document was rejected by the compiler: " + rejection.getMessage(),
          rejection.getCompilerLog());
    }
    throw CompilationException.unavailable("No LaTeX compiler is available", lastFailure);
  }
}
