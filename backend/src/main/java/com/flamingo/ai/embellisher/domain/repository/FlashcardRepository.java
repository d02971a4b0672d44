package com.flamingo.ai.embellisher.domain.repository;

import com.flamingo.ai.embellisher.domain.entity.Flashcard;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Flashcard entities. */
@Repository
public interface FlashcardRepository extends JpaRepository<Flashcard, UUID> {

  List<Flashcard> findByNoteIdOrderByCreatedAtAsc(UUID noteId);
}
