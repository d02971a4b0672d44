package com.flamingo.ai.embellisher.api.dto.response;

import com.flamingo.ai.embellisher.domain.entity.Flashcard;
import com.flamingo.ai.embellisher.domain.enums.FlashcardSource;
import java.time.LocalDateTime;
import java.util.UUID;

/** Response DTO for a flashcard. */
public record FlashcardResponse(
    UUID id,
    String topic,
    String term,
    String definition,
    FlashcardSource source,
    LocalDateTime createdAt) {

  public static FlashcardResponse fromEntity(Flashcard flashcard) {
    return new FlashcardResponse(
        flashcard.getId(),
        flashcard.getTopic(),
        flashcard.getTerm(),
        flashcard.getDefinition(),
        flashcard.getSource(),
        flashcard.getCreatedAt());
  }
}
