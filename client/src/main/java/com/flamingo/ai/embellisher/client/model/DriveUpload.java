package com.flamingo.ai.embellisher.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.UUID;

/** A file placed on the user's drive. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveUpload(
    UUID noteId, String format, String fileId, String fileName, String webViewLink) {}
