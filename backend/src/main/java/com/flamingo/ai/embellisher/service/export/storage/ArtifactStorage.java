package com.flamingo.ai.embellisher.service.export.storage;

import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import java.util.UUID;

/** Stores exported artifacts and resolves them back to bytes. */
public interface ArtifactStorage {

  /**
   * Stores an artifact.
   *
   * @return the public location (URL) of the stored artifact
   */
  String store(UUID noteId, ExportFormat format, String baseName, byte[] content);

  /** Reads back an artifact previously returned by {@link #store}. */
  byte[] load(String location);

  /** Removes every artifact of a note; missing artifacts are ignored. */
  void deleteAll(UUID noteId);
}
