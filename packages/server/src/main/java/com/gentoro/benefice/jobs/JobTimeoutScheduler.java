package com.gentoro.benefice.jobs;

import com.gentoro.benefice.exception.ExceptionUtil;
import com.gentoro.benefice.logging.LoggingService;
import com.gentoro.benefice.session.SessionRef;
import com.gentoro.benefice.session.UserSession;
import com.gentoro.benefice.session.WeakSessionRef;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Reaps jobs whose time-to-live elapsed.
 *
 * <p>A pending timeout only holds a weak reference to the session, so it never keeps an abandoned
 * session alive. When it fires it acts only if the session still exists and still runs the very job
 * it was armed for; a job killed or replaced in the meantime is left alone.
 */
public final class JobTimeoutScheduler implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobTimeoutScheduler.class);

  private final ScheduledExecutorService scheduler =
      Executors.newSingleThreadScheduledExecutor(
          r -> {
            Thread t = new Thread(r, "job-timeouts");
            t.setDaemon(true);
            return t;
          });

  public ScheduledFuture<?> arm(WeakSessionRef<UserSession> session, UUID jobId, Duration ttl) {
    return scheduler.schedule(() -> fire(session, jobId), ttl.toMillis(), TimeUnit.MILLISECONDS);
  }

  void fire(WeakSessionRef<UserSession> session, UUID jobId) {
    Optional<SessionRef<UserSession>> upgraded = session.upgrade();
    if (upgraded.isEmpty()) {
      log.debug("Session of job {} is gone, nothing to time out", jobId);
      return;
    }
    try (SessionRef<UserSession> ref = upgraded.get()) {
      ref.write(
          user -> {
            Optional<Job> current = user.job();
            if (current.isPresent() && current.get().id().equals(jobId)) {
              log.info("timeout for: {}, user_id={}", jobId, user.uid());
              current.get().expire();
              user.clearJob();
            } else {
              log.debug("Timeout for {} is stale, session moved on", jobId);
            }
            return null;
          });
    } catch (RuntimeException e) {
      log.warn(
          "Timeout of job {} failed: {} [{}]",
          jobId,
          e.getMessage(),
          ExceptionUtil.formatCompactStackTrace(e, 5));
    }
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
  }
}
