package com.flamingo.ai.embellisher.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveAuthorization(String authUrl, String state) {}
