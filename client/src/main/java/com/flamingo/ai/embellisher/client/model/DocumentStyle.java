package com.flamingo.ai.embellisher.client.model;

/** Typesetting style for PDF exports. */
public enum DocumentStyle {
  ACADEMIC,
  PERSONAL,
  MINIMALIST
}
