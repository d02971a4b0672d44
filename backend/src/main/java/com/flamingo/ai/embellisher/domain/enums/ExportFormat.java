package com.flamingo.ai.embellisher.domain.enums;

import java.util.Locale;

/** Downloadable artifact formats a completed note can be exported to. */
public enum ExportFormat {
  PDF("pdf", "application/pdf"),
  DOCX("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
  TXT("txt", "text/plain; charset=UTF-8");

  private final String extension;
  private final String mediaType;

  ExportFormat(String extension, String mediaType) {
    this.extension = extension;
    this.mediaType = mediaType;
  }

  public String getExtension() {
    return extension;
  }

  public String getMediaType() {
    return mediaType;
  }

  /**
   * Parses a format name case-insensitively.
   *
   * @throws IllegalArgumentException if the name is not a known format
   */
  public static ExportFormat fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Export format is required");
    }
    for (ExportFormat format : values()) {
      if (format.extension.equals(value.trim().toLowerCase(Locale.ROOT))) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unsupported export format: " + value);
  }
}
