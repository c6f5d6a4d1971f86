package com.gentoro.benefice.exception;

/**
 * A job creation request was refused before any process was started. The {@link #reason()} is
 * what the web layer renders; nothing of the attempt (staged files, reserved ports) survives.
 */
public abstract class JobRejectedException extends BeneficeException {
  private final Rejection reason;

  protected JobRejectedException(BeneficeErrorCode code, Rejection reason, String message) {
    super(code, message);
    this.reason = reason;
  }

  protected JobRejectedException(
      BeneficeErrorCode code, Rejection reason, String message, Throwable cause) {
    super(code, message, cause);
    this.reason = reason;
  }

  public Rejection reason() {
    return reason;
  }
}
