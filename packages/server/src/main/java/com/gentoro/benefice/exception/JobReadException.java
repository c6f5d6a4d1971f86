package com.gentoro.benefice.exception;

/** Genuine I/O failure while reading a workload's output. A read timeout is not one. */
public class JobReadException extends BeneficeException {
  public JobReadException(String message, Throwable cause) {
    super(BeneficeErrorCode.READ_ERROR, message, cause);
  }
}
