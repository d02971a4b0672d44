package com.flamingo.ai.embellisher.domain.repository;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.NoteStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Note entities. */
@Repository
public interface NoteRepository extends JpaRepository<Note, UUID> {

  List<Note> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

  Optional<Note> findByIdAndOwnerId(UUID id, String ownerId);

  long countByStatus(NoteStatus status);
}
