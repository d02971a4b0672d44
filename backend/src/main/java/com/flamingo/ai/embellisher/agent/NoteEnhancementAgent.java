package com.flamingo.ai.embellisher.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that rewrites raw note text into a well-structured Markdown study document.
 *
 * <p>The formatting guidelines are assembled per request from the note's settings.
 */
public interface NoteEnhancementAgent {

  @SystemMessage(
      """
        You are an expert study-notes editor. You turn rough lecture notes, scanned pages and
        quick jottings into clear, accurate and well-organized study material.

        Always answer in GitHub-flavored Markdown. Keep every fact from the source; never invent
        data, quotes or references. Return only the enhanced document, with no preamble and no
        closing remarks.
        """)
  @UserMessage(
      """
        FORMATTING GUIDELINES:
        {{guidelines}}

        ORIGINAL NOTES:
        ===
        {{content}}
        ===
        """)
  String enhance(@V("guidelines") String guidelines, @V("content") String content);
}
