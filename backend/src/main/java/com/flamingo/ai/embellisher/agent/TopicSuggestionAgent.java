package com.flamingo.ai.embellisher.agent;

import com.flamingo.ai.embellisher.agent.dto.TopicSuggestions;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that proposes focus topics for a piece of note text. */
public interface TopicSuggestionAgent {

  @SystemMessage(
      """
        You identify the main study topics in a set of notes. Return between 0 and 8 short topic
        names (2-6 words each), most important first, without duplicates. Return an empty list
        when the text has no identifiable subject.

        Return ONLY valid JSON matching this structure:
        {"topics": ["...", "..."]}
        """)
  @UserMessage("""
        Notes:
        {{content}}
        """)
  TopicSuggestions suggest(@V("content") String content);
}
