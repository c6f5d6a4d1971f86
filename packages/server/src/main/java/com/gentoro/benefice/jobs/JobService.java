package com.gentoro.benefice.jobs;

import com.gentoro.benefice.exception.CapacityException;
import com.gentoro.benefice.exception.JobNotFoundException;
import com.gentoro.benefice.exception.PortException;
import com.gentoro.benefice.ingest.ArtifactIngestor;
import com.gentoro.benefice.ingest.StagedArtifacts;
import com.gentoro.benefice.ingest.UploadPart;
import com.gentoro.benefice.logging.LoggingService;
import com.gentoro.benefice.ports.ListenPorts;
import com.gentoro.benefice.ports.PortRange;
import com.gentoro.benefice.ports.PortRegistry;
import com.gentoro.benefice.session.SessionRef;
import com.gentoro.benefice.session.UserSession;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;

/**
 * Admission control and the job operations the web layer calls.
 *
 * <p>Job creation runs a cheap unlocked pre-check (slot free, global count below the ceiling),
 * then does the expensive work (staging, port parsing, reservation) without any session lock, and
 * finally re-checks both conditions under the session write lock right before spawning and
 * installing the job. Anything acquired along the way is released when the request is rejected.
 */
public final class JobService {
  private static final Logger log = LoggingService.getLogger(JobService.class);

  private final JobLauncher launcher;
  private final PortRegistry registry;
  private final JobTimeoutScheduler timeouts;
  private final ArtifactIngestor ingestor;
  private final Limits limits;
  private final PortRange portRange;
  private final boolean sharedPortProtections;
  private final Duration readTimeout;

  public JobService(
      JobLauncher launcher,
      PortRegistry registry,
      JobTimeoutScheduler timeouts,
      ArtifactIngestor ingestor,
      Limits limits,
      PortRange portRange,
      boolean sharedPortProtections,
      Duration readTimeout) {
    this.launcher = launcher;
    this.registry = registry;
    this.timeouts = timeouts;
    this.ingestor = ingestor;
    this.limits = limits;
    this.portRange = portRange;
    this.sharedPortProtections = sharedPortProtections;
    this.readTimeout = readTimeout;
  }

  /**
   * Admit, stage and start a workload for the session's user.
   *
   * @return the new job id
   * @throws com.gentoro.benefice.exception.JobRejectedException when the request is refused
   * @throws com.gentoro.benefice.exception.SpawnException when the process could not start
   */
  public UUID create(SessionRef<UserSession> session, Iterable<? extends UploadPart> parts) {
    String uid = session.read(UserSession::uid);
    Limits.Decision decision = precheck(session);

    StagedArtifacts artifacts = ingestor.ingest(parts, decision.sizeLimitBytes());
    UUID id = launcher.newJobId();
    SortedSet<Integer> ports = new TreeSet<>();
    boolean reserved = false;
    Job job;
    try {
      ports = ListenPorts.parse(artifacts.readConfig());

      SortedSet<Integer> illegal = portRange.illegal(ports);
      if (!illegal.isEmpty()) {
        throw PortException.illegal(illegal, portRange);
      }

      if (sharedPortProtections) {
        SortedSet<Integer> conflicts = registry.tryReserve(id, ports);
        if (!conflicts.isEmpty()) {
          throw PortException.conflict(conflicts);
        }
        reserved = true;
      }

      SortedSet<Integer> owned = ports;
      job =
          session.write(
              user -> {
                checkAdmissible(user);
                Job spawned = launcher.spawn(id, artifacts, owned);
                user.install(spawned);
                return spawned;
              });
    } catch (RuntimeException e) {
      if (reserved) {
        registry.release(id, ports);
      }
      artifacts.close();
      log.debug("Job request of {} rejected: {}", uid, e.getMessage());
      throw e;
    }

    try {
      timeouts.arm(session.downgrade(), id, decision.ttl());
    } catch (RejectedExecutionException e) {
      log.error("Could not arm timeout for job {}, killing it", id);
      session.write(UserSession::killJob);
      throw e;
    }

    log.info("job started. job_id={}, user_id={}, pid={}, ports={}", id, uid, job.pid(), ports);
    return id;
  }

  /**
   * Unlocked admission check: the caller has no running job and the server is below its job
   * ceiling. Callers run it before reading an upload so a doomed request is refused before any
   * bytes are consumed; {@link #create} repeats it under the session lock.
   *
   * @return the caller's limits, including the workload size limit to read the upload against
   * @throws CapacityException when the request cannot be admitted right now
   */
  public Limits.Decision precheck(SessionRef<UserSession> session) {
    return session.read(
        user -> {
          checkAdmissible(user);
          return limits.decide(user.starred());
        });
  }

  private Void checkAdmissible(UserSession user) {
    if (user.hasRunningJob()) {
      throw CapacityException.alreadyActive(user.uid());
    }
    if (launcher.count() >= launcher.maxJobs()) {
      throw CapacityException.tooManyJobs(launcher.maxJobs());
    }
    return null;
  }

  /** Kill the session's job, if any. */
  public void delete(SessionRef<UserSession> session) {
    session
        .write(UserSession::killJob)
        .ifPresent(job -> log.debug("killing: {}", job.id()));
  }

  /**
   * Newly available output of the session's job, at most {@code capacity} bytes, waiting at most
   * the configured read timeout. An empty array means nothing new.
   *
   * @throws JobNotFoundException when the session has no job
   */
  public byte[] read(SessionRef<UserSession> session, StreamKind kind, int capacity) {
    return session.write(
        user -> {
          Job job =
              user.job().orElseThrow(() -> new JobNotFoundException("No job for " + user.uid()));
          byte[] buffer = new byte[capacity];
          int n = job.read(kind, buffer, readTimeout);
          if (job.isReaped() && job.isDrained()) {
            user.clearJob();
          }
          return Arrays.copyOf(buffer, n);
        });
  }

  public StatusView status(SessionRef<UserSession> session) {
    return session.read(
        user -> {
          Limits.Decision decision = limits.decide(user.starred());
          Optional<JobView> job = user.job().map(JobView::of);
          return new StatusView(user.uid(), user.starred(), decision, portRange, job);
        });
  }

  public int liveJobs() {
    return launcher.count();
  }

  /** Everything the status page shows about a user. */
  public record StatusView(
      String uid,
      boolean starred,
      Limits.Decision limits,
      PortRange portRange,
      Optional<JobView> job) {}

  /** Read-only snapshot of a job. {@code cause} is how it ended, once it has. */
  public record JobView(
      UUID id,
      JobState state,
      Optional<JobState> cause,
      Instant startedAt,
      SortedSet<Integer> ports) {
    static JobView of(Job job) {
      return new JobView(job.id(), job.state(), job.cause(), job.startedAt(), job.ports());
    }
  }
}
