package com.flamingo.ai.embellisher.client.model;

import java.util.Locale;

/** Export formats offered by the server. */
public enum ExportFormat {
  PDF,
  DOCX,
  TXT;

  /** Path and query value, e.g. {@code pdf}. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
