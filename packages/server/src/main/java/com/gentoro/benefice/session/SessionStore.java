package com.gentoro.benefice.session;

import com.gentoro.benefice.logging.LoggingService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;

/**
 * In-memory table of user sessions, keyed by user id.
 *
 * <p>The store owns one strong reference per session. Request handlers borrow another through
 * {@link #acquire(Identity)} and close it when the request ends. Sessions that have not been seen
 * for longer than the idle timeout lose the store's reference; once in-flight requests release
 * theirs the session is dropped and any job it still holds is killed.
 */
public final class SessionStore implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(SessionStore.class);

  private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
  private final Duration idleTimeout;
  private final Clock clock;
  private final ScheduledExecutorService evictor;

  /**
   * @param idleTimeout how long a session may go unused before it is evicted
   * @param sweepInterval how often to look for idle sessions; {@code null} disables the background
   *     sweep (callers then invoke {@link #evictIdle()} themselves)
   */
  public SessionStore(Duration idleTimeout, Duration sweepInterval, Clock clock) {
    this.idleTimeout = idleTimeout;
    this.clock = clock;
    if (sweepInterval != null && !sweepInterval.isZero() && !sweepInterval.isNegative()) {
      this.evictor =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "session-evictor");
                t.setDaemon(true);
                return t;
              });
      long period = sweepInterval.toMillis();
      evictor.scheduleAtFixedRate(this::sweep, period, period, TimeUnit.MILLISECONDS);
    } else {
      this.evictor = null;
    }
  }

  public SessionStore(Duration idleTimeout, Duration sweepInterval) {
    this(idleTimeout, sweepInterval, Clock.systemUTC());
  }

  /** Borrow a strong reference to the session of {@code identity}, creating it on first use. */
  public SessionRef<UserSession> acquire(Identity identity) {
    Instant now = clock.instant();
    AtomicReference<SessionRef<UserSession>> borrowed = new AtomicReference<>();
    sessions.compute(
        identity.uid(),
        (uid, existing) -> {
          Entry entry = existing;
          if (entry == null) {
            log.debug("Opening session for {}", uid);
            UserSession session = new UserSession(uid, identity.starred(), now);
            entry = new Entry(SessionRef.of(session, SessionStore::onDrop), session);
          }
          // lastSeen and starred are volatile; no need to wait for the session lock here
          entry.session().touch(now, identity.starred());
          borrowed.set(entry.ref().retain());
          return entry;
        });
    return borrowed.get();
  }

  /** Drop the store's reference to every session idle for longer than the timeout. */
  public int evictIdle() {
    Instant cutoff = clock.instant().minus(idleTimeout);
    List<String> evicted = new ArrayList<>();
    for (Map.Entry<String, Entry> e : sessions.entrySet()) {
      Entry entry = e.getValue();
      if (entry.session().lastSeen().isBefore(cutoff) && sessions.remove(e.getKey(), entry)) {
        entry.ref().close();
        evicted.add(e.getKey());
      }
    }
    if (!evicted.isEmpty()) {
      log.info("Evicted {} idle session(s): {}", evicted.size(), evicted);
    }
    return evicted.size();
  }

  public int size() {
    return sessions.size();
  }

  private void sweep() {
    try {
      evictIdle();
    } catch (RuntimeException e) {
      log.error("Idle session sweep failed", e);
    }
  }

  private static void onDrop(UserSession session) {
    session
        .killJob()
        .ifPresent(job -> log.info("Session of {} dropped, killed job {}", session.uid(), job.id()));
  }

  /** Drop every session and stop the background sweep. */
  @Override
  public void close() {
    if (evictor != null) {
      evictor.shutdownNow();
    }
    for (String uid : new ArrayList<>(sessions.keySet())) {
      Entry entry = sessions.remove(uid);
      if (entry != null) {
        entry.ref().close();
      }
    }
  }

  private record Entry(SessionRef<UserSession> ref, UserSession session) {}
}
