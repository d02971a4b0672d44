package com.flamingo.ai.embellisher.service.note;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.exception.InputValidationException;
import com.flamingo.ai.embellisher.exception.InputValidationException.Reason;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

class UploadValidatorTest {

  private static final byte[] PNG_HEADER = {
    (byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D, 'I', 'H', 'D', 'R'
  };
  private static final byte[] JPEG_HEADER = {
    (byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10, 'J', 'F', 'I', 'F', 0
  };
  private static final byte[] PDF_HEADER =
      "%PDF-1.4\n1 0 obj\n<< /Type /Catalog >>\nendobj\n".getBytes(StandardCharsets.US_ASCII);

  private UploadValidator validator;

  @BeforeEach
  void setUp() {
    validator = new UploadValidator(new EmbellisherProperties());
  }

  private static MockMultipartFile png(String name) {
    return new MockMultipartFile("files", name, "image/png", PNG_HEADER);
  }

  private static List<MultipartFile> pngs(int count) {
    List<MultipartFile> files = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      files.add(png("page-" + i + ".png"));
    }
    return files;
  }

  @Nested
  @DisplayName("File count")
  class FileCount {

    @Test
    @DisplayName("should accept five files")
    void shouldAcceptFiveFiles() {
      List<UploadedImage> result = validator.validate(pngs(5));

      assertThat(result).hasSize(5);
      assertThat(result).extracting(UploadedImage::fileName).startsWith("page-1.png");
    }

    @Test
    @DisplayName("should reject six files")
    void shouldRejectSixFiles() {
      assertThatThrownBy(() -> validator.validate(pngs(6)))
          .isInstanceOf(InputValidationException.class)
          .extracting(e -> ((InputValidationException) e).getReason())
          .isEqualTo(Reason.TOO_MANY_FILES);
    }

    @Test
    @DisplayName("should reject an empty selection")
    void shouldRejectNoFiles() {
      assertThatThrownBy(() -> validator.validate(List.of()))
          .isInstanceOf(InputValidationException.class)
          .extracting(e -> ((InputValidationException) e).getReason())
          .isEqualTo(Reason.NO_FILES);
    }
  }

  @Nested
  @DisplayName("File content")
  class FileContent {

    @Test
    @DisplayName("should reject a file over 10 MiB")
    void shouldRejectLargeFile() {
      byte[] content = Arrays.copyOf(PNG_HEADER, 11 * 1024 * 1024);
      MultipartFile big = new MockMultipartFile("file", "big.png", "image/png", content);

      assertThatThrownBy(() -> validator.validate(List.of(big)))
          .isInstanceOf(InputValidationException.class)
          .extracting(e -> ((InputValidationException) e).getReason())
          .isEqualTo(Reason.FILE_TOO_LARGE);
    }

    @Test
    @DisplayName("should reject unsupported extension")
    void shouldRejectUnsupportedExtension() {
      MultipartFile gif = new MockMultipartFile("file", "anim.gif", "image/gif", new byte[10]);

      assertThatThrownBy(() -> validator.validate(List.of(gif)))
          .isInstanceOf(InputValidationException.class)
          .extracting(e -> ((InputValidationException) e).getReason())
          .isEqualTo(Reason.UNSUPPORTED_TYPE);
    }

    @Test
    @DisplayName("should reject declared type that disagrees with extension")
    void shouldRejectDeclaredTypeMismatch() {
      MultipartFile file = new MockMultipartFile("file", "scan.png", "application/pdf", PNG_HEADER);

      assertThatThrownBy(() -> validator.validate(List.of(file)))
          .isInstanceOf(InputValidationException.class)
          .extracting(e -> ((InputValidationException) e).getReason())
          .isEqualTo(Reason.TYPE_MISMATCH);
    }

    @Test
    @DisplayName("should reject a text file renamed to .png")
    void shouldRejectRenamedTextFile() {
      MultipartFile renamed =
          new MockMultipartFile(
              "file",
              "notes.png",
              "image/png",
              "These are plain text notes, not an image".getBytes(StandardCharsets.UTF_8));

      assertThatThrownBy(() -> validator.validate(List.of(renamed)))
          .isInstanceOf(InputValidationException.class)
          .extracting(e -> ((InputValidationException) e).getReason())
          .isEqualTo(Reason.TYPE_MISMATCH);
    }

    @Test
    @DisplayName("should accept JPEG and PDF with detected media types")
    void shouldAcceptJpegAndPdf() {
      MultipartFile jpeg = new MockMultipartFile("file", "photo.JPG", "image/jpg", JPEG_HEADER);
      MultipartFile pdf =
          new MockMultipartFile("file", "lecture.pdf", "application/pdf", PDF_HEADER);

      List<UploadedImage> result = validator.validate(List.of(jpeg, pdf));

      assertThat(result)
          .extracting(UploadedImage::mediaType)
          .containsExactly("image/jpeg", "application/pdf");
      assertThat(result.get(1).isPdf()).isTrue();
    }
  }

  @Nested
  @DisplayName("Text")
  class Text {

    @Test
    @DisplayName("should reject whitespace-only text")
    void shouldRejectBlankText() {
      assertThatThrownBy(() -> validator.validateText("  \n\t "))
          .isInstanceOf(InputValidationException.class)
          .extracting(e -> ((InputValidationException) e).getReason())
          .isEqualTo(Reason.EMPTY_TEXT);
    }

    @Test
    @DisplayName("should strip surrounding whitespace")
    void shouldStripText() {
      assertThat(validator.validateText("  Mitosis  ")).isEqualTo("Mitosis");
    }
  }
}
