package com.flamingo.ai.embellisher.api.rest;

import com.flamingo.ai.embellisher.api.dto.request.TopicPreviewRequest;
import com.flamingo.ai.embellisher.api.dto.response.TopicSuggestionResponse;
import com.flamingo.ai.embellisher.service.topic.TopicPreviewService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for focus-topic suggestions. */
@RestController
@RequestMapping("/api/topics")
@RequiredArgsConstructor
public class TopicController {

  private final TopicPreviewService topicPreviewService;

  @PostMapping("/preview")
  public ResponseEntity<TopicSuggestionResponse> preview(
      @Valid @RequestBody TopicPreviewRequest request) {
    return ResponseEntity.ok(
        new TopicSuggestionResponse(topicPreviewService.suggestTopics(request.getText())));
  }
}
