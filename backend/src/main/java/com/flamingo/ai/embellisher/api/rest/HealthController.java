package com.flamingo.ai.embellisher.api.rest;

import com.flamingo.ai.embellisher.domain.enums.NoteStatus;
import com.flamingo.ai.embellisher.domain.repository.NoteRepository;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for liveness and basic pipeline statistics. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final NoteRepository noteRepository;

  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "note-embellisher");
    return ResponseEntity.ok(health);
  }

  /** Returns note counts by status. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    Map<String, Object> stats = new HashMap<>();
    stats.put("totalNotes", noteRepository.count());
    for (NoteStatus status : NoteStatus.values()) {
      stats.put(
          status.name().toLowerCase(Locale.ROOT) + "Notes", noteRepository.countByStatus(status));
    }
    stats.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(stats);
  }
}
