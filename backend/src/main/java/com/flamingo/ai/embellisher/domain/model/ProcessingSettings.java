package com.flamingo.ai.embellisher.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.embellisher.domain.enums.LatexStyle;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options that shape how a note is enhanced and exported.
 *
 * <p>Persisted with the note as a JSON column. Instances coming from clients are passed through
 * {@link #normalized()} before they are stored.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessingSettings {

  public static final int MAX_FLASHCARDS = 50;
  public static final int DEFAULT_FLASHCARDS = 10;

  private boolean bullets;
  private boolean headers;
  private boolean expand;
  private boolean summarize;

  @Builder.Default
  @Size(max = 20)
  private List<String> focusTopics = new ArrayList<>();

  @Valid private FlashcardDirectives flashcards;

  private LatexStyle style;

  @Size(max = 100)
  private String fontPreference;

  @Size(max = 2000)
  private String customInstructions;

  @Valid private PresentationMetadata presentation;

  @JsonIgnore
  @AssertTrue(message = "At least one enhancement option must be selected")
  public boolean isAnyEnhancementSelected() {
    return bullets || headers || expand || summarize;
  }

  @JsonIgnore
  public boolean isFlashcardsRequested() {
    return flashcards != null && flashcards.isEnabled();
  }

  /**
   * Returns a copy with blank and duplicate topics removed and the flashcard count clamped to
   * {@code [max(1, topicCount), 50]}.
   */
  public ProcessingSettings normalized() {
    ProcessingSettingsBuilder copy = toBuilder().focusTopics(uniqueTopics(focusTopics));
    if (flashcards != null) {
      List<String> topics = uniqueTopics(flashcards.getTopics());
      int lower = Math.max(1, topics.size());
      int requested =
          flashcards.getCount() == null
              ? Math.max(lower, DEFAULT_FLASHCARDS)
              : flashcards.getCount();
      int clamped = Math.max(lower, Math.min(MAX_FLASHCARDS, requested));
      copy.flashcards(new FlashcardDirectives(flashcards.isEnabled(), topics, clamped));
    }
    return copy.build();
  }

  private static List<String> uniqueTopics(List<String> topics) {
    if (topics == null) {
      return new ArrayList<>();
    }
    Set<String> unique = new LinkedHashSet<>();
    for (String topic : topics) {
      if (topic != null && !topic.isBlank()) {
        unique.add(topic.trim());
      }
    }
    return new ArrayList<>(unique);
  }

  /** Flashcard generation directives. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class FlashcardDirectives {
    private boolean enabled;
    private List<String> topics = new ArrayList<>();
    private Integer count;
  }

  /** Title page details used by exported documents. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class PresentationMetadata {
    @Size(max = 200)
    private String projectName;

    @Size(max = 200)
    private String title;

    @Size(max = 100)
    private String nickname;

    private boolean includeNickname;
  }
}
