package com.gentoro.benefice.jobs;

/** Lifecycle state of a workload job. */
public enum JobState {
  /** Process handle obtained, output readers not yet attached. */
  CREATED,
  /** Process is running and its output is being captured. */
  RUNNING,
  /** Terminated on user request. */
  KILLED,
  /** Terminated because its time-to-live elapsed. */
  TIMED_OUT,
  /** Process exited on its own. */
  EXITED,
  /** Ports released and live count decremented; the job holds no resources anymore. */
  REAPED
}
