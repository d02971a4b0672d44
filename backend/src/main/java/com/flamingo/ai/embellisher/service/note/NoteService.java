package com.flamingo.ai.embellisher.service.note;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings.PresentationMetadata;
import java.util.List;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Service for creating and reading notes. Creation returns before processing finishes. */
public interface NoteService {

  Note createTextNote(String ownerId, String text, ProcessingSettings settings);

  Note createSingleImageNote(String ownerId, MultipartFile file, ProcessingSettings settings);

  /** Creates a note from 2 to 5 pages that are read together. */
  Note createMultiImageNote(String ownerId, List<MultipartFile> files, ProcessingSettings settings);

  Note getNote(String ownerId, UUID noteId);

  List<Note> listNotes(String ownerId);

  Note updateMetadata(String ownerId, UUID noteId, PresentationMetadata metadata);

  void deleteNote(String ownerId, UUID noteId);
}
