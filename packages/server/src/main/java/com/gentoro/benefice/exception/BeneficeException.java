package com.gentoro.benefice.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of all Benefice runtime failures.
 *
 * <p>Every exception carries a {@link BeneficeErrorCode} and an optional context map with
 * structured details (ports, limits, identifiers) that endpoints can render without parsing the
 * message.
 */
public class BeneficeException extends RuntimeException {
  private final BeneficeErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public BeneficeException(BeneficeErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public BeneficeException(BeneficeErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public BeneficeErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry, returning {@code this} for chaining. */
  public BeneficeException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
