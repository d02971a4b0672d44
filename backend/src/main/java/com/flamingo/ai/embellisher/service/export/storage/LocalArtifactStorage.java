package com.flamingo.ai.embellisher.service.export.storage;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import com.flamingo.ai.embellisher.exception.ArtifactStorageException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Filesystem artifact storage. Files live under {@code <storage-dir>/<noteId>/} and are served
 * read-only below the configured public path.
 */
@Component
@Slf4j
public class LocalArtifactStorage implements ArtifactStorage {

  private final Path baseDir;
  private final String publicPrefix;

  public LocalArtifactStorage(EmbellisherProperties properties) {
    EmbellisherProperties.Export export = properties.getExport();
    this.baseDir = Path.of(export.getStorageDir()).toAbsolutePath().normalize();
    this.publicPrefix = trimTrailingSlash(export.getPublicBaseUrl()) + export.getPublicPath() + "/";
  }

  @Override
  public String store(UUID noteId, ExportFormat format, String baseName, byte[] content) {
    String fileName =
        baseName + "-" + UUID.randomUUID().toString().substring(0, 8) + "." + format.getExtension();
    Path noteDir = baseDir.resolve(noteId.toString());
    Path output = noteDir.resolve(fileName);
    Path tmp = noteDir.resolve(fileName + ".tmp");
    try {
      Files.createDirectories(noteDir);
      Files.write(tmp, content);
      try {
        Files.move(tmp, output, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(tmp);
      throw new ArtifactStorageException("Failed to store artifact " + fileName, e);
    }
    log.debug("Stored {} ({} bytes) for note {}", fileName, content.length, noteId);
    return publicPrefix + noteId + "/" + fileName;
  }

  @Override
  public byte[] load(String location) {
    if (location == null || !location.startsWith(publicPrefix)) {
      throw new ArtifactStorageException("Unknown artifact location: " + location, null);
    }
    Path file = baseDir.resolve(location.substring(publicPrefix.length())).normalize();
    if (!file.startsWith(baseDir)) {
      throw new ArtifactStorageException("Artifact location escapes storage: " + location, null);
    }
    try {
      return Files.readAllBytes(file);
    } catch (IOException e) {
      throw new ArtifactStorageException("Failed to read artifact " + location, e);
    }
  }

  @Override
  public void deleteAll(UUID noteId) {
    Path noteDir = baseDir.resolve(noteId.toString());
    if (!Files.exists(noteDir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(noteDir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(LocalArtifactStorage::deleteQuietly);
    } catch (IOException e) {
      log.warn("Failed to delete artifacts of note {}: {}", noteId, e.getMessage());
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }

  private static String trimTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
