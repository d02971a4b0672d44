package com.flamingo.ai.embellisher.domain.enums;

/** Origin of a flashcard. */
public enum FlashcardSource {
  AI,
  MANUAL
}
