package com.flamingo.ai.embellisher.client.validation;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks note input before it is sent. Has no side effects and never throws for bad input; the
 * server repeats these checks and additionally inspects file contents.
 */
public class InputValidator {

  public static final int MAX_FILES = 5;
  public static final long MAX_FILE_BYTES = 10L * 1024 * 1024;

  private static final Map<String, String> MEDIA_TYPE_BY_EXTENSION =
      Map.of(
          "png", "image/png",
          "jpg", "image/jpeg",
          "jpeg", "image/jpeg",
          "pdf", "application/pdf");

  public ValidationResult validateText(String text) {
    if (text == null || text.isBlank()) {
      return ValidationResult.rejected(
          RejectionReason.EMPTY_TEXT, "Please enter some text to process");
    }
    return ValidationResult.accepted();
  }

  /** Checks the count first, then each file in order; the first problem found is reported. */
  public ValidationResult validateFiles(List<SelectedFile> files) {
    if (files == null || files.isEmpty()) {
      return ValidationResult.rejected(
          RejectionReason.NO_FILES, "Please select at least one image or PDF");
    }
    if (files.size() > MAX_FILES) {
      return ValidationResult.rejected(
          RejectionReason.TOO_MANY_FILES,
          "You can upload at most " + MAX_FILES + " files at once (selected " + files.size() + ")");
    }
    for (SelectedFile file : files) {
      ValidationResult result = validateFile(file);
      if (!result.isAccepted()) {
        return result;
      }
    }
    return ValidationResult.accepted();
  }

  private ValidationResult validateFile(SelectedFile file) {
    if (file.sizeBytes() > MAX_FILE_BYTES) {
      return ValidationResult.rejected(
          RejectionReason.FILE_TOO_LARGE, file.name() + " is larger than 10 MB");
    }

    String expected = MEDIA_TYPE_BY_EXTENSION.get(extensionOf(file.name()));
    if (expected == null) {
      return ValidationResult.rejected(
          RejectionReason.UNSUPPORTED_TYPE,
          file.name() + " is not supported. Use PNG, JPEG or PDF files");
    }

    String declared = normalizeMediaType(file.mediaType());
    if (declared == null) {
      // Some pickers report no type; the extension decides.
      return ValidationResult.accepted();
    }
    if (!MEDIA_TYPE_BY_EXTENSION.containsValue(declared)) {
      return ValidationResult.rejected(
          RejectionReason.UNSUPPORTED_TYPE,
          file.name() + " has unsupported type " + declared + ". Use PNG, JPEG or PDF files");
    }
    if (!declared.equals(expected)) {
      return ValidationResult.rejected(
          RejectionReason.TYPE_EXTENSION_MISMATCH,
          file.name() + " is declared as " + declared + " but its extension suggests " + expected);
    }
    return ValidationResult.accepted();
  }

  static String extensionOf(String fileName) {
    if (fileName == null) {
      return "";
    }
    int dot = fileName.lastIndexOf('.');
    return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static String normalizeMediaType(String mediaType) {
    if (mediaType == null || mediaType.isBlank()) {
      return null;
    }
    String base = mediaType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return "image/jpg".equals(base) ? "image/jpeg" : base;
  }
}
