package com.gentoro.benefice.exception;

/** Stable error codes exposed in logs and API error payloads. */
public enum BeneficeErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  NETWORK_ERROR,
  IO_ERROR,
  VALIDATION_ERROR,
  CAPACITY_ERROR,
  RESOURCE_CONFLICT,
  SPAWN_ERROR,
  READ_ERROR,
  NOT_FOUND
}
