package com.flamingo.ai.embellisher.agent.dto;

import java.util.List;

/** Structured output from TopicSuggestionAgent. */
public record TopicSuggestions(List<String> topics) {}
