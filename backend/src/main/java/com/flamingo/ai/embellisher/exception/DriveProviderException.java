package com.flamingo.ai.embellisher.exception;

/** Exception thrown when the cloud drive provider fails a request. */
public class DriveProviderException extends RuntimeException {

  private final int providerStatus;

  public DriveProviderException(String message, int providerStatus) {
    super(message);
    this.providerStatus = providerStatus;
  }

  public DriveProviderException(String message, Throwable cause) {
    super(message, cause);
    this.providerStatus = 0;
  }

  /** HTTP status returned by the provider, or 0 if no response was received. */
  public int getProviderStatus() {
    return providerStatus;
  }

  public String getUserMessage() {
    return "The cloud drive rejected the request. Please try again later.";
  }
}
