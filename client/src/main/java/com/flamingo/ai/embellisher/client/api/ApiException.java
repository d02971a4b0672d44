package com.flamingo.ai.embellisher.client.api;

/** An error response from the note service. */
public class ApiException extends RuntimeException {

  private final int status;
  private final String code;
  private final String errorId;

  public ApiException(int status, String code, String message, String errorId) {
    super(message);
    this.status = status;
    this.code = code;
    this.errorId = errorId;
  }

  public int getStatus() {
    return status;
  }

  /** Server error code such as {@code NOTE_002}; null if the body carried none. */
  public String getCode() {
    return code;
  }

  public String getErrorId() {
    return errorId;
  }
}
