package com.flamingo.ai.embellisher.domain.enums;

/** How the raw note material was supplied. */
public enum InputType {
  TEXT,
  SINGLE_IMAGE,
  MULTI_IMAGE
}
