package com.flamingo.ai.embellisher.service.topic;

import com.flamingo.ai.embellisher.agent.TopicSuggestionAgent;
import com.flamingo.ai.embellisher.agent.dto.TopicSuggestions;
import com.flamingo.ai.embellisher.exception.InputValidationException;
import com.flamingo.ai.embellisher.exception.LlmServiceException;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Suggests focus topics for note text before it is submitted. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopicPreviewService {

  static final int MIN_TEXT_LENGTH = 50;
  static final int MAX_TOPICS = 8;
  private static final int MAX_INPUT_CHARS = 12_000;

  private final TopicSuggestionAgent topicAgent;

  /**
   * Returns up to eight distinct topics, possibly none.
   *
   * @throws InputValidationException if the text is shorter than 50 characters
   */
  @Timed(value = "topics.preview", description = "Time to suggest focus topics")
  public List<String> suggestTopics(String text) {
    String trimmed = text == null ? "" : text.strip();
    if (trimmed.length() < MIN_TEXT_LENGTH) {
      throw new InputValidationException(
          InputValidationException.Reason.TEXT_TOO_SHORT,
          "Text must be at least " + MIN_TEXT_LENGTH + " characters to suggest topics");
    }
    if (trimmed.length() > MAX_INPUT_CHARS) {
      trimmed = trimmed.substring(0, MAX_INPUT_CHARS);
    }

    TopicSuggestions suggestions;
    try {
      suggestions = topicAgent.suggest(trimmed);
    } catch (RuntimeException e) {
      log.error("Topic suggestion failed: {}", e.getMessage());
      throw new LlmServiceException("Topic suggestion failed: " + e.getMessage(), e);
    }
    if (suggestions == null || suggestions.topics() == null) {
      return List.of();
    }

    Set<String> seen = new LinkedHashSet<>();
    List<String> topics = new ArrayList<>();
    for (String topic : suggestions.topics()) {
      if (topic == null || topic.isBlank()) {
        continue;
      }
      String clean = topic.strip();
      if (seen.add(clean.toLowerCase(Locale.ROOT))) {
        topics.add(clean);
      }
      if (topics.size() == MAX_TOPICS) {
        break;
      }
    }
    return topics;
  }
}
