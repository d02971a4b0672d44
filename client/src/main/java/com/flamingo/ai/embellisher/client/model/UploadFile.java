package com.flamingo.ai.embellisher.client.model;

import com.flamingo.ai.embellisher.client.validation.SelectedFile;

/** An image or PDF page chosen for submission, with its bytes. */
public record UploadFile(String name, String mediaType, byte[] content) {

  /** Describes this file for validation without exposing its bytes. */
  public SelectedFile selection() {
    return new SelectedFile(name, mediaType, content == null ? 0 : content.length);
  }
}
