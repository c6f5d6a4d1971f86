package com.gentoro.benefice.exception;

/** Failures while staging or cleaning up files. */
public class IoException extends BeneficeException {
  public IoException(String message) {
    super(BeneficeErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(BeneficeErrorCode.IO_ERROR, message, cause);
  }
}
