package com.flamingo.ai.embellisher.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveStatus(boolean connected, Instant expiresAt, boolean hasRefreshToken) {}
