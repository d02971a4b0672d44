package com.flamingo.ai.embellisher.client.model;

/** Where a generated export can be downloaded. */
public record ArtifactReference(String format, String artifactUrl) {}
