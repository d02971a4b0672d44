package com.flamingo.ai.embellisher.api.dto.response;

/** Authorization URL the user opens to connect the drive. */
public record DriveAuthUrlResponse(String authUrl, String state) {}
