package com.flamingo.ai.embellisher.service.topic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.embellisher.agent.TopicSuggestionAgent;
import com.flamingo.ai.embellisher.agent.dto.TopicSuggestions;
import com.flamingo.ai.embellisher.exception.InputValidationException;
import com.flamingo.ai.embellisher.exception.LlmServiceException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TopicPreviewServiceTest {

  private static final String TEXT =
      "Mitosis is the process by which a eukaryotic cell separates its chromosomes.";

  @Mock private TopicSuggestionAgent topicAgent;

  private TopicPreviewService service;

  @BeforeEach
  void setUp() {
    service = new TopicPreviewService(topicAgent);
  }

  @Test
  @DisplayName("should reject text shorter than 50 characters without calling the model")
  void shouldRejectShortText() {
    assertThatThrownBy(() -> service.suggestTopics("too short"))
        .isInstanceOf(InputValidationException.class)
        .extracting(e -> ((InputValidationException) e).getReason())
        .isEqualTo(InputValidationException.Reason.TEXT_TOO_SHORT);
    verifyNoInteractions(topicAgent);
  }

  @Test
  @DisplayName("should return distinct non-blank topics in model order")
  void shouldDedupeTopics() {
    when(topicAgent.suggest(anyString()))
        .thenReturn(
            new TopicSuggestions(Arrays.asList("Mitosis", " prophase ", "mitosis", "", null)));

    assertThat(service.suggestTopics(TEXT)).containsExactly("Mitosis", "prophase");
  }

  @Test
  @DisplayName("should accept an empty suggestion list")
  void shouldAllowEmptyList() {
    when(topicAgent.suggest(anyString())).thenReturn(new TopicSuggestions(List.of()));

    assertThat(service.suggestTopics(TEXT)).isEmpty();
  }

  @Test
  @DisplayName("should wrap model failures as an AI service error")
  void shouldWrapModelFailure() {
    when(topicAgent.suggest(anyString())).thenThrow(new RuntimeException("HTTP 429 Too Many"));

    assertThatThrownBy(() -> service.suggestTopics(TEXT))
        .isInstanceOf(LlmServiceException.class)
        .satisfies(e -> assertThat(((LlmServiceException) e).isRateLimited()).isTrue());
  }
}
