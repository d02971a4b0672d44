package com.flamingo.ai.embellisher.service.processing;

import com.flamingo.ai.embellisher.agent.NoteEnhancementAgent;
import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Turns raw note text into enhanced Markdown according to the note's settings. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentEnhancementService {

  private final NoteEnhancementAgent enhancementAgent;
  private final EmbellisherProperties properties;

  @Timed(value = "note.enhance", description = "Time to enhance note content")
  @Retry(name = "llm")
  public String enhance(String rawText, ProcessingSettings settings) {
    int maxChars = properties.getProcessing().getMaxInputChars();
    String input = rawText;
    if (input.length() > maxChars) {
      log.warn("Truncating note input from {} to {} chars", input.length(), maxChars);
      input = input.substring(0, maxChars);
    }

    String enhanced = enhancementAgent.enhance(buildGuidelines(settings), input);
    if (enhanced == null || enhanced.isBlank()) {
      throw new IllegalStateException("The AI service returned an empty response");
    }
    return stripCodeFence(enhanced.strip());
  }

  /** Formatting guidelines for the enhancement prompt, one bullet per line. */
  String buildGuidelines(ProcessingSettings settings) {
    List<String> guidelines = new ArrayList<>();
    guidelines.add("Reorganize the notes into a clear, readable study document");
    guidelines.add("Fix spelling and grammar while keeping the author's meaning");

    if (settings.isBullets()) {
      guidelines.add("Use bullet points and nested sub-bullets for lists and key points");
      guidelines.add("Use numbered lists for sequential processes or priorities");
    }
    if (settings.isHeaders()) {
      guidelines.add("Create a clear hierarchy with descriptive Markdown headers (#, ##, ###)");
      guidelines.add("Start with a short introduction and end with a conclusion section");
    }
    if (settings.isExpand()) {
      guidelines.add("Expand the content with explanations, examples and background context");
      guidelines.add("Add practical applications or implications where they help understanding");
    }
    if (settings.isSummarize()) {
      guidelines.add("Begin with a short summary of the key takeaways");
      guidelines.add("End with a concise recap that reinforces the main points");
    }
    if (!settings.getFocusTopics().isEmpty()) {
      guidelines.add(
          "Give extra depth to these topics: " + String.join(", ", settings.getFocusTopics()));
    }
    if (settings.getCustomInstructions() != null && !settings.getCustomInstructions().isBlank()) {
      guidelines.add("Also follow these instructions: " + settings.getCustomInstructions().strip());
    }

    StringBuilder sb = new StringBuilder();
    for (String guideline : guidelines) {
      sb.append("- ").append(guideline).append('\n');
    }
    return sb.toString();
  }

  private static String stripCodeFence(String text) {
    if (text.startsWith("```") && text.endsWith("```") && text.length() > 6) {
      int firstNewline = text.indexOf('\n');
      if (firstNewline > 0) {
        return text.substring(firstNewline + 1, text.length() - 3).strip();
      }
    }
    return text;
  }
}
