package com.gentoro.benefice.exception;

/** Invalid or missing configuration. */
public class ConfigException extends BeneficeException {
  public ConfigException(String message) {
    super(BeneficeErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(BeneficeErrorCode.CONFIG_ERROR, message, cause);
  }
}
