package com.flamingo.ai.embellisher.client.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ProgressTimeEstimator")
class ProgressTimeEstimatorTest {

  private final ProgressTimeEstimator estimator = new ProgressTimeEstimator();

  private static String words(int count) {
    return "word ".repeat(count);
  }

  @Nested
  @DisplayName("Text")
  class Text {

    @Test
    void shouldUseMinimum_forShortText() {
      ProcessingEstimate estimate = estimator.forText("Mitosis");

      assertThat(estimate.expected()).isEqualTo(Duration.ofSeconds(45));
      assertThat(estimate.timeout()).isEqualTo(Duration.ofSeconds(75));
      assertThat(estimate.pollInterval()).isEqualTo(ProgressTimeEstimator.TEXT_INTERVAL);
    }

    @Test
    void shouldScaleWithWordCount() {
      ProcessingEstimate estimate = estimator.forText(words(1000));

      assertThat(estimate.expected()).isEqualTo(Duration.ofSeconds(150));
      assertThat(estimate.timeout()).isEqualTo(Duration.ofSeconds(180));
    }

    @Test
    void shouldClampToMaximum_forLongText() {
      ProcessingEstimate estimate = estimator.forText(words(10_000));

      assertThat(estimate.expected()).isEqualTo(Duration.ofSeconds(240));
      assertThat(estimate.timeout()).isLessThanOrEqualTo(ProgressTimeEstimator.CEILING);
    }

    @Test
    void shouldNeverShrink_whenWordsAreAdded() {
      Duration previous = Duration.ZERO;
      for (int count = 0; count <= 3000; count += 250) {
        Duration expected = estimator.forText(words(count)).expected();
        assertThat(expected).isGreaterThanOrEqualTo(previous);
        previous = expected;
      }
    }
  }

  @Nested
  @DisplayName("Images")
  class Images {

    @Test
    void shouldEstimateSingleImage() {
      ProcessingEstimate estimate = estimator.forImages(1);

      assertThat(estimate.expected()).isEqualTo(Duration.ofSeconds(60));
      assertThat(estimate.timeout()).isEqualTo(Duration.ofSeconds(110));
      assertThat(estimate.pollInterval()).isEqualTo(ProgressTimeEstimator.IMAGE_INTERVAL);
    }

    @Test
    void shouldAddConsolidationTime_forBatches() {
      ProcessingEstimate estimate = estimator.forImages(2);

      assertThat(estimate.expected()).isEqualTo(Duration.ofSeconds(150));
      assertThat(estimate.timeout()).isEqualTo(Duration.ofSeconds(220));
    }

    @Test
    void shouldCapBatchEstimate_andStayUnderCeiling() {
      ProcessingEstimate estimate = estimator.forImages(5);

      assertThat(estimate.expected()).isEqualTo(Duration.ofSeconds(300));
      assertThat(estimate.timeout()).isEqualTo(Duration.ofSeconds(430));
      assertThat(estimate.timeout()).isLessThanOrEqualTo(ProgressTimeEstimator.MULTI_IMAGE_CEILING);
    }

    @Test
    void shouldRejectNonPositiveCount() {
      assertThatThrownBy(() -> estimator.forImages(0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  void shouldCountWhitespaceSeparatedWords() {
    assertThat(ProgressTimeEstimator.countWords("  cell\tdivision\n\nphases ")).isEqualTo(3);
    assertThat(ProgressTimeEstimator.countWords("   ")).isZero();
  }
}
