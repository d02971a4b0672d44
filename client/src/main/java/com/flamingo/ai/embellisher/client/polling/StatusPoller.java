package com.flamingo.ai.embellisher.client.polling;

import com.flamingo.ai.embellisher.client.api.NoteApi;
import com.flamingo.ai.embellisher.client.model.NoteView;
import com.flamingo.ai.embellisher.client.progress.ProcessingEstimate;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Watches a note until it reaches a terminal status.
 *
 * <p>A note that ends in {@code ERROR} completes the loop normally; the listener inspects the
 * status. Only a query failure or the timeout from the estimate is reported as a failure.
 */
@Slf4j
@RequiredArgsConstructor
public class StatusPoller {

  private final NoteApi noteApi;

  public PollHandle<NoteView> watch(
      UUID noteId,
      ProcessingEstimate estimate,
      PollingScope scope,
      PollListener<NoteView> listener) {
    PollUntil<NoteView> poll =
        PollUntil.<NoteView>builder("status poll " + noteId)
            .query(() -> noteApi.getNote(noteId))
            .until(NoteView::isTerminal)
            .interval(estimate.pollInterval())
            .timeout(estimate.timeout())
            .build();
    log.debug(
        "Watching note {} every {} ms for up to {} s",
        noteId,
        estimate.pollInterval().toMillis(),
        estimate.timeout().toSeconds());
    return scope.start(poll, listener);
  }
}
