package com.flamingo.ai.embellisher.client.api;

/** The user has not connected a cloud drive, or the connection was revoked. */
public class DriveNotConnectedException extends ApiException {

  public static final String CODE = "DRIVE_001";

  public DriveNotConnectedException(String message, String errorId) {
    super(409, CODE, message, errorId);
  }
}
