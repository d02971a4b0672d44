package com.flamingo.ai.embellisher.security;

/** Caller identity established from a verified bearer credential. */
public record AuthenticatedUser(String userId, String email) {}
