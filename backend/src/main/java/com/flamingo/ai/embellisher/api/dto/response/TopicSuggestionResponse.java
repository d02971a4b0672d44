package com.flamingo.ai.embellisher.api.dto.response;

import java.util.List;

/** Suggested focus topics; may be empty. */
public record TopicSuggestionResponse(List<String> topics) {}
