package com.flamingo.ai.embellisher.agent.dto;

import java.util.List;

/** Structured output from FlashcardGenerationAgent. */
public record GeneratedFlashcards(List<Card> cards) {

  /** A single generated card. */
  public record Card(String topic, String term, String definition) {}
}
