package com.worksync.collaboration.service;

public class AuthenticationFailedException extends RuntimeException {

  public enum Reason {
    MISSING_CREDENTIAL,
    INVALID_TOKEN,
    EXPIRED_TOKEN,
    UNKNOWN_USER
  }

  private final Reason reason;

  public AuthenticationFailedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AuthenticationFailedException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
