package com.flamingo.ai.embellisher.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.embellisher.domain.model.ProcessingSettings.FlashcardDirectives;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProcessingSettingsTest {

  @Test
  @DisplayName("should require at least one enhancement toggle")
  void shouldDetectMissingEnhancement() {
    assertThat(ProcessingSettings.builder().build().isAnyEnhancementSelected()).isFalse();
    assertThat(ProcessingSettings.builder().summarize(true).build().isAnyEnhancementSelected())
        .isTrue();
  }

  @Test
  @DisplayName("should dedupe and trim focus topics keeping first occurrence order")
  void shouldNormalizeFocusTopics() {
    ProcessingSettings settings =
        ProcessingSettings.builder()
            .bullets(true)
            .focusTopics(List.of(" Mitosis ", "Meiosis", "Mitosis", "", "Meiosis"))
            .build();

    assertThat(settings.normalized().getFocusTopics()).containsExactly("Mitosis", "Meiosis");
  }

  @Test
  @DisplayName("should clamp flashcard count to at most 50")
  void shouldClampFlashcardCountUpper() {
    ProcessingSettings settings =
        ProcessingSettings.builder()
            .bullets(true)
            .flashcards(new FlashcardDirectives(true, List.of(), 500))
            .build();

    assertThat(settings.normalized().getFlashcards().getCount()).isEqualTo(50);
  }

  @Test
  @DisplayName("should raise flashcard count to the number of topics")
  void shouldClampFlashcardCountToTopicCount() {
    ProcessingSettings settings =
        ProcessingSettings.builder()
            .bullets(true)
            .flashcards(new FlashcardDirectives(true, List.of("A", "B", "C"), 1))
            .build();

    assertThat(settings.normalized().getFlashcards().getCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("should default flashcard count when none given")
  void shouldDefaultFlashcardCount() {
    ProcessingSettings settings =
        ProcessingSettings.builder()
            .bullets(true)
            .flashcards(new FlashcardDirectives(true, List.of(), null))
            .build();

    assertThat(settings.normalized().getFlashcards().getCount())
        .isEqualTo(ProcessingSettings.DEFAULT_FLASHCARDS);
    assertThat(settings.normalized().isFlashcardsRequested()).isTrue();
  }

  @Test
  @DisplayName("should not request flashcards when disabled")
  void shouldNotRequestFlashcardsWhenDisabled() {
    ProcessingSettings settings =
        ProcessingSettings.builder()
            .bullets(true)
            .flashcards(new FlashcardDirectives(false, List.of("A"), 5))
            .build();

    assertThat(settings.isFlashcardsRequested()).isFalse();
  }
}
