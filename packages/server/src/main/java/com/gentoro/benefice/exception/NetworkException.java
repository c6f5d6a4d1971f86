package com.gentoro.benefice.exception;

/** Failures while binding or serving HTTP. */
public class NetworkException extends BeneficeException {
  public NetworkException(String message) {
    super(BeneficeErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(BeneficeErrorCode.NETWORK_ERROR, message, cause);
  }
}
