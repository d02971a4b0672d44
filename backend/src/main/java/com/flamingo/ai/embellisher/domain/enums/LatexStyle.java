package com.flamingo.ai.embellisher.domain.enums;

/** Typesetting style applied to PDF exports. */
public enum LatexStyle {
  ACADEMIC,
  PERSONAL,
  MINIMALIST
}
