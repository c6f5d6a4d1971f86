package com.gentoro.benefice.exception;

/** The session has no workload to act on. */
public class JobNotFoundException extends BeneficeException {
  public JobNotFoundException(String message) {
    super(BeneficeErrorCode.NOT_FOUND, message);
  }
}
