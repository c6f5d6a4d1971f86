package com.gentoro.benefice.exception;

/** The workload process could not be started. */
public class SpawnException extends BeneficeException {
  public SpawnException(String message, Throwable cause) {
    super(BeneficeErrorCode.SPAWN_ERROR, message, cause);
  }
}
