package com.flamingo.ai.embellisher.client.api;

/** The bearer credential was missing, invalid or expired. Retrying will not help. */
public class AuthorizationException extends ApiException {

  public AuthorizationException(String code, String message, String errorId) {
    super(401, code, message, errorId);
  }
}
