package com.gentoro.benefice.exception;

/** Reasons a job creation request can be turned down. */
public enum Rejection {
  /** The global concurrent job ceiling is reached. */
  TOO_MANY_JOBS,
  /** The user already has a running job. */
  JOB_ALREADY_ACTIVE,
  /** The configuration declares ports outside the allowed range. */
  ILLEGAL_PORTS,
  /** The configuration declares ports another running job holds. */
  PORT_CONFLICT,
  /** An uploaded artifact is over its size limit. */
  PAYLOAD_TOO_LARGE,
  /** The workload artifact does not declare the expected content type. */
  UNSUPPORTED_MEDIA_TYPE,
  /** The multipart upload is missing, duplicating or mis-typing an artifact. */
  MALFORMED_UPLOAD,
  /** The configuration artifact could not be parsed. */
  MALFORMED_CONFIG
}
