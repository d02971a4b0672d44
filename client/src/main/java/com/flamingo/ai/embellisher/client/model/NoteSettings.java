package com.flamingo.ai.embellisher.client.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Enhancement options sent with a submission. At least one toggle must be set. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NoteSettings {

  boolean bullets;
  boolean headers;
  boolean expand;
  boolean summarize;

  @Builder.Default List<String> focusTopics = List.of();

  FlashcardOptions flashcards;
  DocumentStyle style;
  String fontPreference;
  String customInstructions;

  public boolean hasEnhancement() {
    return bullets || headers || expand || summarize;
  }

  /** Flashcard request. The server clamps the count. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record FlashcardOptions(boolean enabled, List<String> topics, Integer count) {}
}
