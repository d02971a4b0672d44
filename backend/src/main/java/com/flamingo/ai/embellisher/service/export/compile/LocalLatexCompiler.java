package com.flamingo.ai.embellisher.service.export.compile;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.exception.CompilationException;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs a locally installed {@code pdflatex} in a scratch directory. The configured timeout bounds
 * the whole compilation, all passes together.
 */
@Component
@Order(1)
@Slf4j
public class LocalLatexCompiler implements LatexCompiler {

  private static final String JOB_NAME = "document";

  private final EmbellisherProperties.Compilation.Local config;

  public LocalLatexCompiler(EmbellisherProperties properties) {
    this.config = properties.getCompilation().getLocal();
  }

  @Override
  public String name() {
    return "local";
  }

  @Override
  public boolean isEnabled() {
    return config.isEnabled();
  }

  /** True if the configured command resolves to an executable file. */
  boolean isInstalled() {
    String command = config.getCommand();
    if (command.contains(File.separator)) {
      return Files.isExecutable(Path.of(command));
    }
    String path = System.getenv("PATH");
    if (path == null) {
      return false;
    }
    for (String dir : path.split(File.pathSeparator)) {
      if (!dir.isBlank() && Files.isExecutable(Path.of(dir, command))) {
        return true;
      }
    }
    return false;
  }

  @Override
  public byte[] compile(String latex) {
    if (!isInstalled()) {
      throw CompilationException.unavailable(config.getCommand() + " is not installed", null);
    }

    Path workDir = null;
    try {
      workDir = Files.createTempDirectory("latex-");
      Path source = workDir.resolve(JOB_NAME + ".tex");
      Files.writeString(source, latex, StandardCharsets.UTF_8);

      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.getTimeoutSeconds());
      // Second pass resolves cross references
      for (int pass = 1; pass <= Math.max(1, config.getPasses()); pass++) {
        runPass(workDir, pass, deadline);
      }

      Path pdf = workDir.resolve(JOB_NAME + ".pdf");
      if (!Files.exists(pdf)) {
        throw CompilationException.rejected("pdflatex produced no PDF", readLog(workDir));
      }
      return Files.readAllBytes(pdf);
    } catch (IOException e) {
      throw CompilationException.unavailable("Local compilation failed: " + e.getMessage(), e);
    } finally {
      deleteRecursively(workDir);
    }
  }

  private void runPass(Path workDir, int pass, long deadline) throws IOException {
    long remaining = deadline - System.nanoTime();
    if (remaining <= 0) {
      throw timedOut();
    }
    Path output = workDir.resolve("pass-" + pass + ".out");
    Process process =
        new ProcessBuilder(
                List.of(
                    config.getCommand(),
                    "-interaction=nonstopmode",
                    "-halt-on-error",
                    "-jobname=" + JOB_NAME,
                    JOB_NAME + ".tex"))
            .directory(workDir.toFile())
            .redirectErrorStream(true)
            .redirectOutput(output.toFile())
            .start();
    try {
      if (!process.waitFor(remaining, TimeUnit.NANOSECONDS)) {
        process.destroyForcibly();
        log.debug("pdflatex pass {} hit the deadline", pass);
        throw timedOut();
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw CompilationException.unavailable("Interrupted while running pdflatex", e);
    }

    if (process.exitValue() != 0) {
      log.debug("pdflatex pass {} exited with {}", pass, process.exitValue());
      throw CompilationException.rejected(
          "pdflatex exited with code " + process.exitValue(), readLog(workDir));
    }
  }

  private CompilationException timedOut() {
    return CompilationException.unavailable(
        "pdflatex timed out after " + config.getTimeoutSeconds() + "s", null);
  }

  private static String readLog(Path workDir) {
    Path logFile = workDir.resolve(JOB_NAME + ".log");
    try {
      return Files.exists(logFile) ? Files.readString(logFile, StandardCharsets.ISO_8859_1) : null;
    } catch (IOException e) {
      log.warn("Could not read pdflatex log: {}", e.getMessage());
      return null;
    }
  }

  private static void deleteRecursively(Path dir) {
    if (dir == null) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).map(Path::toFile).forEach(File::delete);
    } catch (IOException e) {
      log.warn("Failed to clean up {}: {}", dir, e.getMessage());
    }
  }
}
