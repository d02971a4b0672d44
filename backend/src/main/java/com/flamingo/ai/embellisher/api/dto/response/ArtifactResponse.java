package com.flamingo.ai.embellisher.api.dto.response;

/** Location of a generated export artifact. */
public record ArtifactResponse(String format, String artifactUrl) {}
