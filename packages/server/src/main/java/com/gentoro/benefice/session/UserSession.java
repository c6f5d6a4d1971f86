package com.gentoro.benefice.session;

import com.gentoro.benefice.jobs.Job;
import com.gentoro.benefice.logging.LoggingService;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Per-user server-side state: identity, quota tier and the single job slot.
 *
 * <p>The job slot is only read or changed while the owning {@link SessionRef} lock is held; the
 * slot transitions from empty to occupied only through {@link #install(Job)}.
 */
public final class UserSession {
  private static final Logger log = LoggingService.getLogger(UserSession.class);

  private final String uid;
  private volatile boolean starred;
  private volatile Instant lastSeen;
  private Job job;

  public UserSession(String uid, boolean starred, Instant now) {
    this.uid = uid;
    this.starred = starred;
    this.lastSeen = now;
  }

  public String uid() {
    return uid;
  }

  public boolean starred() {
    return starred;
  }

  public Instant lastSeen() {
    return lastSeen;
  }

  void touch(Instant now, boolean starred) {
    this.lastSeen = now;
    this.starred = starred;
  }

  /**
   * The job in the slot. A job that already exited stays visible until its remaining output has
   * been read; after that the slot reads as empty.
   */
  public Optional<Job> job() {
    if (job == null || (job.isReaped() && job.isDrained())) {
      return Optional.empty();
    }
    return Optional.of(job);
  }

  /** True when the slot holds a job whose process has not been reaped yet. */
  public boolean hasRunningJob() {
    return job != null && !job.isReaped();
  }

  /** Put {@code next} into the slot. A finished job still lingering there is discarded. */
  public void install(Job next) {
    if (hasRunningJob()) {
      throw new IllegalStateException("Session of " + uid + " already runs job " + job.id());
    }
    if (job != null) {
      log.debug("Discarding finished job {} of {}", job.id(), uid);
      job.kill();
    }
    this.job = next;
  }

  /** Empty the slot without touching the job. */
  public Optional<Job> clearJob() {
    Job current = job;
    job = null;
    return Optional.ofNullable(current);
  }

  /** Kill the job in the slot, if any, and empty the slot. */
  public Optional<Job> killJob() {
    Optional<Job> current = clearJob();
    current.ifPresent(Job::kill);
    return current;
  }

  @Override
  public String toString() {
    return "UserSession[" + uid + "]";
  }
}
