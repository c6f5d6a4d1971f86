package com.gentoro.benefice.exception;

import java.time.Instant;
import java.util.Map;

/** Flattened view of a failure, suitable for logging or JSON responses. */
public record ErrorDetails(
    String type,
    String message,
    BeneficeErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
