package com.flamingo.ai.embellisher.service.note;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.exception.InputValidationException;
import com.flamingo.ai.embellisher.exception.InputValidationException.Reason;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/**
 * Server-side guard for note uploads.
 *
 * <p>Checks the file count, per-file size, the declared type against the file extension, and the
 * actual content type sniffed from the bytes. Rejections are user-correctable and carry a {@link
 * Reason}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UploadValidator {

  private static final Map<String, String> EXTENSION_TYPES =
      Map.of(
          "png", "image/png",
          "jpg", "image/jpeg",
          "jpeg", "image/jpeg",
          "pdf", "application/pdf");

  private final EmbellisherProperties properties;
  private final Tika tika = new Tika();

  /**
   * Validates a batch of uploads.
   *
   * @return the uploads with their detected media types, in submission order
   * @throws InputValidationException if any constraint is violated
   */
  public List<UploadedImage> validate(List<MultipartFile> files) {
    EmbellisherProperties.Upload limits = properties.getUpload();
    if (files == null || files.isEmpty()) {
      throw new InputValidationException(Reason.NO_FILES, "Select at least one file");
    }
    if (files.size() > limits.getMaxFiles()) {
      throw new InputValidationException(
          Reason.TOO_MANY_FILES, "You can upload at most " + limits.getMaxFiles() + " files");
    }

    List<UploadedImage> accepted = new ArrayList<>(files.size());
    for (MultipartFile file : files) {
      accepted.add(validateFile(file, limits));
    }
    return accepted;
  }

  /** Rejects empty or whitespace-only text submissions. */
  public String validateText(String text) {
    if (text == null || text.isBlank()) {
      throw new InputValidationException(Reason.EMPTY_TEXT, "Note text must not be empty");
    }
    return text.strip();
  }

  private UploadedImage validateFile(MultipartFile file, EmbellisherProperties.Upload limits) {
    String fileName = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
    if (file.getSize() > limits.getMaxFileSizeBytes()) {
      throw new InputValidationException(
          Reason.FILE_TOO_LARGE,
          fileName + " is larger than " + limits.getMaxFileSizeBytes() / (1024 * 1024) + " MB");
    }

    String extensionType = EXTENSION_TYPES.get(extensionOf(fileName));
    if (extensionType == null || !limits.getAllowedMediaTypes().contains(extensionType)) {
      throw new InputValidationException(
          Reason.UNSUPPORTED_TYPE, fileName + " is not a PNG, JPEG or PDF file");
    }

    String declared = normalizeMediaType(file.getContentType());
    if (declared != null
        && !"application/octet-stream".equals(declared)
        && !declared.equals(extensionType)) {
      throw new InputValidationException(
          Reason.TYPE_MISMATCH, fileName + " has type " + declared + " but a different extension");
    }

    byte[] bytes;
    try {
      bytes = file.getBytes();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read upload " + fileName, e);
    }
    String detected = normalizeMediaType(tika.detect(bytes));
    if (!extensionType.equals(detected)) {
      log.debug("Content of {} detected as {}, expected {}", fileName, detected, extensionType);
      throw new InputValidationException(
          Reason.TYPE_MISMATCH, fileName + " content does not match its file type");
    }
    return new UploadedImage(fileName, detected, bytes);
  }

  private static String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static String normalizeMediaType(String mediaType) {
    if (mediaType == null || mediaType.isBlank()) {
      return null;
    }
    String base = mediaType.split(";")[0].trim().toLowerCase(Locale.ROOT);
    return "image/jpg".equals(base) ? "image/jpeg" : base;
  }
}
