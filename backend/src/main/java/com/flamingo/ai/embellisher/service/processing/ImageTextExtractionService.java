package com.flamingo.ai.embellisher.service.processing;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.service.note.UploadedImage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Reads note text out of uploaded images and PDFs with a vision model.
 *
 * <p>All pages of one submission go to the model in a single request so it can follow content
 * that continues across pages. PDFs with an embedded text layer skip the model entirely.
 */
@Service
@Slf4j
public class ImageTextExtractionService {

  private static final String SINGLE_PAGE_PROMPT =
      """
      Transcribe all text in this image of study notes. Keep the original structure (headings,
      lists, numbering, equations written as LaTeX math). Mark unreadable words with [?].
      Return only the transcription.
      """;

  private static final String MULTI_PAGE_PROMPT =
      """
      These %d images are consecutive pages of the same study notes, in order. Transcribe them
      as ONE continuous document: join sentences and lists that continue across page breaks, do
      not repeat page headers, and keep the original structure (headings, lists, numbering,
      equations written as LaTeX math). Mark unreadable words with [?].
      Return only the transcription.
      """;

  private final ChatModel visionChatModel;
  private final EmbellisherProperties properties;

  public ImageTextExtractionService(
      @Qualifier("visionChatModel") ChatModel visionChatModel, EmbellisherProperties properties) {
    this.visionChatModel = visionChatModel;
    this.properties = properties;
  }

  /**
   * Extracts the text of one submission.
   *
   * @param uploads one or more validated uploads, in page order
   * @return the transcribed text, never null
   */
  @Timed(value = "note.extract", description = "Time to extract text from uploads")
  @Retry(name = "llm")
  public String extract(List<UploadedImage> uploads) {
    List<String> textLayers = new ArrayList<>();
    List<ImageContent> pages = new ArrayList<>();

    for (UploadedImage upload : uploads) {
      if (upload.isPdf()) {
        collectPdf(upload, textLayers, pages);
      } else {
        pages.add(
            ImageContent.from(
                Base64.getEncoder().encodeToString(upload.content()), upload.mediaType()));
      }
    }

    StringBuilder text = new StringBuilder(String.join("\n\n", textLayers));
    if (!pages.isEmpty()) {
      if (text.length() > 0) {
        text.append("\n\n");
      }
      text.append(transcribe(pages));
    }
    return text.toString().strip();
  }

  private String transcribe(List<ImageContent> pages) {
    String prompt =
        pages.size() == 1 ? SINGLE_PAGE_PROMPT : String.format(MULTI_PAGE_PROMPT, pages.size());
    List<Content> contents = new ArrayList<>();
    contents.add(TextContent.from(prompt));
    contents.addAll(pages);

    log.debug("Sending {} page(s) to vision model", pages.size());
    String transcription = visionChatModel.chat(UserMessage.from(contents)).aiMessage().text();
    return transcription == null ? "" : transcription;
  }

  /** Uses the PDF text layer when present, otherwise renders pages for the vision model. */
  private void collectPdf(UploadedImage upload, List<String> textLayers, List<ImageContent> pages) {
    EmbellisherProperties.Processing config = properties.getProcessing();
    try (PDDocument document = Loader.loadPDF(upload.content())) {
      String layer = new PDFTextStripper().getText(document);
      if (layer != null && !layer.isBlank()) {
        log.debug("Using embedded text layer of {}", upload.fileName());
        textLayers.add(layer.strip());
        return;
      }

      PDFRenderer renderer = new PDFRenderer(document);
      int pageCount = Math.min(document.getNumberOfPages(), config.getMaxPdfPages());
      for (int i = 0; i < pageCount; i++) {
        BufferedImage image =
            renderer.renderImageWithDPI(i, config.getPdfRenderDpi(), ImageType.RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        pages.add(
            ImageContent.from(Base64.getEncoder().encodeToString(out.toByteArray()), "image/png"));
      }
      log.debug("Rendered {} page(s) of {}", pageCount, upload.fileName());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read PDF " + upload.fileName(), e);
    }
  }
}
