package com.gentoro.benefice.exception;

/** Bad upload shape, type, size or configuration syntax. */
public class ValidationException extends JobRejectedException {
  public ValidationException(Rejection reason, String message) {
    super(BeneficeErrorCode.VALIDATION_ERROR, reason, message);
  }

  public ValidationException(Rejection reason, String message, Throwable cause) {
    super(BeneficeErrorCode.VALIDATION_ERROR, reason, message, cause);
  }
}
