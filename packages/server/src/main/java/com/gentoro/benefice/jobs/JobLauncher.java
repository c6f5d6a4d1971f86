package com.gentoro.benefice.jobs;

import com.gentoro.benefice.exception.CapacityException;
import com.gentoro.benefice.exception.SpawnException;
import com.gentoro.benefice.ingest.StagedArtifacts;
import com.gentoro.benefice.logging.LoggingService;
import com.gentoro.benefice.ports.PortRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.SortedSet;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Starts workload processes and keeps the process-wide count of live jobs.
 *
 * <p>The count is raised with a compare-and-set that never passes {@code maxJobs}, so the global
 * ceiling holds even when admissions for different users commit at the same time. Every job lowers
 * the count exactly once, when it is reaped.
 */
public class JobLauncher implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobLauncher.class);

  private final String command;
  private final int maxJobs;
  private final PortRegistry registry;
  private final AtomicInteger live = new AtomicInteger();
  private final AtomicInteger pumpThreads = new AtomicInteger();
  private final ExecutorService pumps;

  public JobLauncher(String command, int maxJobs, PortRegistry registry) {
    if (maxJobs < 1) {
      throw new IllegalArgumentException("maxJobs must be positive: " + maxJobs);
    }
    this.command = command;
    this.maxJobs = maxJobs;
    this.registry = registry;
    this.pumps =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "job-output-" + pumpThreads.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public UUID newJobId() {
    return UUID.randomUUID();
  }

  /** Number of jobs spawned and not yet reaped. */
  public int count() {
    return live.get();
  }

  public int maxJobs() {
    return maxJobs;
  }

  /**
   * Run {@code <command> run --wasmcfgfile <config> <workload>}.
   *
   * <p>On success the job owns {@code artifacts} and {@code ports}. On failure neither is touched:
   * the caller still owns and must release them.
   *
   * @throws CapacityException when the live count already is at the ceiling
   * @throws SpawnException when the process cannot be created
   */
  public Job spawn(UUID id, StagedArtifacts artifacts, SortedSet<Integer> ports) {
    if (!tryAcquireSlot()) {
      throw CapacityException.tooManyJobs(maxJobs);
    }

    List<String> argv =
        List.of(
            command,
            "run",
            "--wasmcfgfile",
            artifacts.config().toString(),
            artifacts.workload().toString());
    Process process;
    try {
      process = new ProcessBuilder(argv).start();
    } catch (IOException | RuntimeException e) {
      live.decrementAndGet();
      throw new SpawnException("Failed to spawn " + command, e);
    }

    try {
      process.getOutputStream().close();
    } catch (IOException e) {
      log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
    }

    Job job = new Job(id, process, ports, artifacts, Instant.now(), this::onReaped);
    job.start(pumps);
    log.debug("Spawned job {} as pid {}: {}", id, process.pid(), argv);
    return job;
  }

  private boolean tryAcquireSlot() {
    while (true) {
      int current = live.get();
      if (current >= maxJobs) return false;
      if (live.compareAndSet(current, current + 1)) return true;
    }
  }

  private void onReaped(Job job) {
    registry.release(job.id(), job.ports());
    live.decrementAndGet();
  }

  @Override
  public void close() {
    pumps.shutdownNow();
  }
}
