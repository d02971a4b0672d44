package com.flamingo.ai.embellisher.agent;

import com.flamingo.ai.embellisher.agent.dto.GeneratedFlashcards;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that writes term/definition flashcards from enhanced notes. */
public interface FlashcardGenerationAgent {

  @SystemMessage(
      """
        You write concise study flashcards. Each card has a short "term" (a concept, name or
        question) and a "definition" of one to three sentences that answers it using only the
        provided notes. Assign every card to one of the requested topics; if no topics are given,
        use the most fitting subject of the notes.

        Return ONLY valid JSON matching this structure:
        {"cards": [{"topic": "...", "term": "...", "definition": "..."}]}
        """)
  @UserMessage(
      """
        Write exactly {{count}} flashcards.
        Topics: {{topics}}

        Notes:
        {{content}}
        """)
  GeneratedFlashcards generate(
      @V("content") String content, @V("topics") String topics, @V("count") int count);
}
