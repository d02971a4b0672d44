package com.flamingo.ai.embellisher.client.progress;

import java.time.Duration;

/**
 * Heuristic processing-time estimates derived from input size.
 *
 * <p>Text costs a fixed 30 s plus 0.12 s per word, kept within 45 to 240 s. One image costs 60 s;
 * batches cost 65 s per image plus 20 s for consolidation, at most 300 s. The polling timeout adds
 * a margin of 30 s plus 20 s per image and never exceeds the absolute ceiling (5 minutes, or 8
 * minutes for batches).
 */
public class ProgressTimeEstimator {

  static final Duration TEXT_INTERVAL = Duration.ofMillis(1000);
  static final Duration IMAGE_INTERVAL = Duration.ofMillis(1500);
  static final Duration CEILING = Duration.ofMinutes(5);
  static final Duration MULTI_IMAGE_CEILING = Duration.ofMinutes(8);

  private static final double TEXT_BASE_SECONDS = 30;
  private static final double SECONDS_PER_WORD = 0.12;
  private static final double TEXT_MIN_SECONDS = 45;
  private static final double TEXT_MAX_SECONDS = 240;
  private static final long SINGLE_IMAGE_SECONDS = 60;
  private static final long SECONDS_PER_BATCH_IMAGE = 65;
  private static final long CONSOLIDATION_SECONDS = 20;
  private static final long BATCH_MAX_SECONDS = 300;
  private static final long MARGIN_BASE_SECONDS = 30;
  private static final long MARGIN_PER_IMAGE_SECONDS = 20;

  public ProcessingEstimate forText(String text) {
    double seconds = TEXT_BASE_SECONDS + SECONDS_PER_WORD * countWords(text);
    seconds = Math.max(TEXT_MIN_SECONDS, Math.min(TEXT_MAX_SECONDS, seconds));
    Duration expected = Duration.ofMillis(Math.round(seconds * 1000));
    return new ProcessingEstimate(
        expected, cap(expected.plusSeconds(MARGIN_BASE_SECONDS), CEILING), TEXT_INTERVAL);
  }

  /**
   * @throws IllegalArgumentException if {@code imageCount} is less than one
   */
  public ProcessingEstimate forImages(int imageCount) {
    if (imageCount < 1) {
      throw new IllegalArgumentException("imageCount must be at least 1, was " + imageCount);
    }
    long seconds =
        imageCount == 1
            ? SINGLE_IMAGE_SECONDS
            : Math.min(
                BATCH_MAX_SECONDS, SECONDS_PER_BATCH_IMAGE * imageCount + CONSOLIDATION_SECONDS);
    Duration expected = Duration.ofSeconds(seconds);
    Duration margin =
        Duration.ofSeconds(MARGIN_BASE_SECONDS + MARGIN_PER_IMAGE_SECONDS * imageCount);
    Duration ceiling = imageCount >= 2 ? MULTI_IMAGE_CEILING : CEILING;
    return new ProcessingEstimate(expected, cap(expected.plus(margin), ceiling), IMAGE_INTERVAL);
  }

  static int countWords(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    return text.strip().split("\\s+").length;
  }

  private static Duration cap(Duration value, Duration ceiling) {
    return value.compareTo(ceiling) > 0 ? ceiling : value;
  }
}
