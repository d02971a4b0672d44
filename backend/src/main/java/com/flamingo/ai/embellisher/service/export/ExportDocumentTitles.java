package com.flamingo.ai.embellisher.service.export;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings.PresentationMetadata;
import java.text.Normalizer;
import java.util.Locale;

/** Title, author and file name rules shared by the export converters. */
public final class ExportDocumentTitles {

  static final String DEFAULT_TITLE = "Notes";
  static final String DEFAULT_AUTHOR = "Student";

  private ExportDocumentTitles() {}

  /** Explicit title override, then project name, then "Notes". */
  public static String title(Note note) {
    PresentationMetadata meta = note.getSettings().getPresentation();
    if (meta != null && hasText(meta.getTitle())) {
      return meta.getTitle().strip();
    }
    if (meta != null && hasText(meta.getProjectName())) {
      return meta.getProjectName().strip();
    }
    return DEFAULT_TITLE;
  }

  /** The nickname if the user asked to include it, otherwise "Student". */
  public static String author(Note note) {
    PresentationMetadata meta = note.getSettings().getPresentation();
    if (meta != null && meta.isIncludeNickname() && hasText(meta.getNickname())) {
      return meta.getNickname().strip();
    }
    return DEFAULT_AUTHOR;
  }

  /** Lower-case ASCII slug of the title, used as the artifact file name. */
  public static String fileSlug(Note note) {
    String ascii =
        Normalizer.normalize(title(note), Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    String slug =
        ascii.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
    if (slug.isEmpty()) {
      slug = "notes";
    }
    return slug.length() > 60 ? slug.substring(0, 60) : slug;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
