package com.flamingo.ai.embellisher.client.progress;

import java.time.Duration;

/**
 * Advisory timing for one submission.
 *
 * @param expected how long processing usually takes, for progress display
 * @param timeout how long the status poller waits before giving up
 * @param pollInterval delay between status queries
 */
public record ProcessingEstimate(Duration expected, Duration timeout, Duration pollInterval) {}
