package com.gentoro.benefice.exception;

/** The server or the user has no room for another job right now. */
public class CapacityException extends JobRejectedException {
  public CapacityException(Rejection reason, String message) {
    super(BeneficeErrorCode.CAPACITY_ERROR, reason, message);
  }

  public static CapacityException tooManyJobs(int limit) {
    CapacityException e =
        new CapacityException(
            Rejection.TOO_MANY_JOBS, "Too many workloads are running, limit is " + limit);
    e.withContext("limit", limit);
    return e;
  }

  public static CapacityException alreadyActive(String uid) {
    return new CapacityException(
        Rejection.JOB_ALREADY_ACTIVE, "User " + uid + " already has a running workload");
  }
}
