package com.flamingo.ai.embellisher.service.note;

/**
 * A validated upload held in memory until the processing worker consumes it.
 *
 * @param fileName original client file name
 * @param mediaType content type detected from the bytes
 * @param content raw file bytes
 */
public record UploadedImage(String fileName, String mediaType, byte[] content) {

  public boolean isPdf() {
    return "application/pdf".equals(mediaType);
  }
}
