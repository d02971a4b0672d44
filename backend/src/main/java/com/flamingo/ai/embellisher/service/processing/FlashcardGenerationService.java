package com.flamingo.ai.embellisher.service.processing;

import com.flamingo.ai.embellisher.agent.FlashcardGenerationAgent;
import com.flamingo.ai.embellisher.agent.dto.GeneratedFlashcards;
import com.flamingo.ai.embellisher.domain.entity.Flashcard;
import com.flamingo.ai.embellisher.domain.enums.FlashcardSource;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings.FlashcardDirectives;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates study flashcards from enhanced note content. */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlashcardGenerationService {

  private final FlashcardGenerationAgent flashcardAgent;

  /**
   * Generates up to {@code directives.count} cards.
   *
   * @return unsaved flashcards; cards without a term or definition are dropped
   */
  @Timed(value = "note.flashcards", description = "Time to generate flashcards")
  @Retry(name = "llm")
  public List<Flashcard> generate(String content, FlashcardDirectives directives) {
    String topics =
        directives.getTopics().isEmpty()
            ? "(choose from the notes)"
            : String.join(", ", directives.getTopics());
    int count = directives.getCount();

    GeneratedFlashcards generated = flashcardAgent.generate(content, topics, count);
    if (generated == null || generated.cards() == null) {
      return List.of();
    }

    List<Flashcard> cards = new ArrayList<>();
    for (GeneratedFlashcards.Card card : generated.cards()) {
      if (cards.size() == count) {
        break;
      }
      if (isBlank(card.term()) || isBlank(card.definition())) {
        continue;
      }
      cards.add(
          Flashcard.builder()
              .topic(isBlank(card.topic()) ? null : card.topic().strip())
              .term(card.term().strip())
              .definition(card.definition().strip())
              .source(FlashcardSource.AI)
              .build());
    }
    log.debug("Generated {} of {} requested flashcards", cards.size(), count);
    return cards;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
