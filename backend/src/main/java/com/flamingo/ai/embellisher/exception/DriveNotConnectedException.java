package com.flamingo.ai.embellisher.exception;

/** Exception thrown when a drive operation needs a connection the user has not granted. */
public class DriveNotConnectedException extends RuntimeException {

  private final String ownerId;

  public DriveNotConnectedException(String ownerId) {
    super("Cloud drive is not connected for user " + ownerId);
    this.ownerId = ownerId;
  }

  public DriveNotConnectedException(String ownerId, String message) {
    super(message);
    this.ownerId = ownerId;
  }

  public String getOwnerId() {
    return ownerId;
  }
}
