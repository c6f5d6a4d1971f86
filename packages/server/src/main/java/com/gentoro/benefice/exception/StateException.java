package com.gentoro.benefice.exception;

/** A component was used in an invalid lifecycle state. */
public class StateException extends BeneficeException {
  public StateException(String message) {
    super(BeneficeErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(BeneficeErrorCode.STATE_ERROR, message, cause);
  }
}
