package com.flamingo.ai.embellisher.client.submission;

/** Server endpoint a submission is sent to. */
public enum SubmissionPath {
  TEXT,
  SINGLE_IMAGE,
  MULTI_IMAGE
}
