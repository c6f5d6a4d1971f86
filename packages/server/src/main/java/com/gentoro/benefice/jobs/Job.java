package com.gentoro.benefice.jobs;

import com.gentoro.benefice.exception.JobReadException;
import com.gentoro.benefice.ingest.StagedArtifacts;
import com.gentoro.benefice.logging.LoggingService;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * One supervised workload process with its captured output, reserved ports and staged files.
 *
 * <p>Resources are given back exactly once, by whichever comes first of {@link #kill()}, {@link
 * #expire()} or the process exiting on its own. Callers serialize access through the owning
 * session's lock; the reap itself is safe to race.
 */
public final class Job {
  private static final Logger log = LoggingService.getLogger(Job.class);

  static final int PIPE_CAPACITY = 1024 * 1024;
  static final Duration KILL_GRACE = Duration.ofSeconds(5);

  private final UUID id;
  private final Process process;
  private final SortedSet<Integer> ports;
  private final StagedArtifacts artifacts;
  private final Instant startedAt;
  private final Consumer<Job> onReap;
  private final OutputPipe stdout;
  private final OutputPipe stderr;
  private final AtomicBoolean reaped = new AtomicBoolean(false);

  private volatile JobState state = JobState.CREATED;
  private volatile JobState cause;
  private volatile JobState requested;

  Job(
      UUID id,
      Process process,
      SortedSet<Integer> ports,
      StagedArtifacts artifacts,
      Instant startedAt,
      Consumer<Job> onReap) {
    this.id = id;
    this.process = process;
    this.ports = Collections.unmodifiableSortedSet(new TreeSet<>(ports));
    this.artifacts = artifacts;
    this.startedAt = startedAt;
    this.onReap = onReap;
    this.stdout = new OutputPipe(id + "/stdout", PIPE_CAPACITY);
    this.stderr = new OutputPipe(id + "/stderr", PIPE_CAPACITY);
  }

  /** Attach output pumps and the exit watcher. */
  void start(Executor pumps) {
    pumps.execute(() -> stdout.pump(process.getInputStream()));
    pumps.execute(() -> stderr.pump(process.getErrorStream()));
    state = JobState.RUNNING;
    process.onExit().thenRun(() -> reap(JobState.EXITED));
  }

  public UUID id() {
    return id;
  }

  public SortedSet<Integer> ports() {
    return ports;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public long pid() {
    return process.pid();
  }

  /** Current state; {@link JobState#REAPED} once resources are released. */
  public JobState state() {
    return reaped.get() ? JobState.REAPED : state;
  }

  /** What ended the job: killed, timed out or exited. Empty while running. */
  public Optional<JobState> cause() {
    return Optional.ofNullable(cause);
  }

  public boolean isReaped() {
    return reaped.get();
  }

  /** True once the job is reaped and both output streams have been fully handed out. */
  public boolean isDrained() {
    return stdout.isDrained() && stderr.isDrained();
  }

  /**
   * Read newly available bytes from one of the output streams.
   *
   * @return number of bytes placed at the start of {@code buffer}; 0 means nothing new arrived
   *     within {@code timeout} or the stream is finished
   * @throws JobReadException when the stream failed
   */
  public int read(StreamKind kind, byte[] buffer, Duration timeout) {
    OutputPipe pipe = kind == StreamKind.OUTPUT ? stdout : stderr;
    try {
      return pipe.read(buffer, timeout);
    } catch (IOException e) {
      throw new JobReadException("Failed to read " + kind + " of job " + id, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return 0;
    }
  }

  /** Terminate on request. Safe to call repeatedly and after the process exited. */
  public void kill() {
    terminate(JobState.KILLED);
  }

  /** Terminate because the time-to-live elapsed. */
  public void expire() {
    terminate(JobState.TIMED_OUT);
  }

  private void terminate(JobState why) {
    if (requested == null) {
      requested = why;
    }
    if (process.isAlive()) {
      log.debug("Terminating job {} (pid {}): {}", id, process.pid(), why);
      process.descendants().forEach(ProcessHandle::destroyForcibly);
      process.destroyForcibly();
      try {
        if (!process.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Job {} (pid {}) did not exit within {}", id, process.pid(), KILL_GRACE);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    reap(why);
    stdout.discard();
    stderr.discard();
  }

  void reap(JobState why) {
    if (!reaped.compareAndSet(false, true)) return;
    // the exit watcher may win the race against terminate(); keep the requested label
    JobState label = requested != null ? requested : why;
    cause = label;
    state = label;
    try {
      onReap.accept(this);
    } finally {
      artifacts.close();
      log.info("Job {} reaped: {}", id, label);
    }
  }

  @Override
  public String toString() {
    return "Job[" + id + ", " + state() + "]";
  }
}
