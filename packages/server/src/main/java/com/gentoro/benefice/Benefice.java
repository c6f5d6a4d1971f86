package com.gentoro.benefice;

import com.gentoro.benefice.endpoints.Authenticator;
import com.gentoro.benefice.endpoints.HeaderAuthenticator;
import com.gentoro.benefice.endpoints.WorkloadServer;
import com.gentoro.benefice.exception.ExceptionUtil;
import com.gentoro.benefice.exception.NetworkException;
import com.gentoro.benefice.exception.StateException;
import com.gentoro.benefice.http.EmbeddedJettyServer;
import com.gentoro.benefice.ingest.ArtifactIngestor;
import com.gentoro.benefice.jobs.JobLauncher;
import com.gentoro.benefice.jobs.JobService;
import com.gentoro.benefice.jobs.JobTimeoutScheduler;
import com.gentoro.benefice.logging.LoggingService;
import com.gentoro.benefice.ports.PortRegistry;
import com.gentoro.benefice.session.SessionStore;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Wires the job server together and owns the lifecycle of its services. */
public class Benefice {
  private static final Logger log = LoggingService.getLogger(Benefice.class);

  private static final Duration SESSION_SWEEP_INTERVAL = Duration.ofMinutes(1);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ServerSettings settings;
  private PortRegistry portRegistry;
  private JobLauncher launcher;
  private JobTimeoutScheduler timeouts;
  private JobService jobService;
  private SessionStore sessions;
  private Authenticator authenticator;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public Benefice(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider =
        new ConfigurationProvider(startupParameters.configFile(), startupParameters.overrides());
    LoggingService.applyConfiguration(configuration());
    this.settings = ServerSettings.from(configuration());

    this.portRegistry = new PortRegistry();
    this.launcher = new JobLauncher(settings.command(), settings.maxJobs(), portRegistry);
    this.timeouts = new JobTimeoutScheduler();
    this.jobService =
        new JobService(
            launcher,
            portRegistry,
            timeouts,
            new ArtifactIngestor(settings.stagingDir()),
            settings.limits(),
            settings.portRange(),
            settings.sharedPortProtections(),
            settings.readTimeout());
    this.sessions = new SessionStore(settings.sessionIdleTimeout(), SESSION_SWEEP_INTERVAL);
    this.authenticator =
        new HeaderAuthenticator(settings.userHeader(), settings.starredHeader());

    this.httpServer = new EmbeddedJettyServer(this);
    httpServer.prepare();
    try {
      new WorkloadServer(this).register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new NetworkException("Could not start http server", ex));
    }
    log.info(
        "Serving jobs with '{}': max {} concurrent, ports {}, shared port protections {}",
        settings.command(),
        settings.maxJobs(),
        settings.portRange(),
        settings.sharedPortProtections() ? "on" : "off");
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "benefice-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) return;
    try {
      // stop taking requests first, then kill what is still running
      closeQuietly(httpServer);
      closeQuietly(sessions);
      closeQuietly(timeouts);
      closeQuietly(launcher);
    } finally {
      shutdownLatch.countDown();
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable == null) return;
    try {
      closeable.close();
    } catch (Exception e) {
      log.warn("Failed to close {}: {}", closeable.getClass().getSimpleName(), e.toString());
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Benefice not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public ServerSettings settings() {
    if (settings == null) {
      throw new StateException("Benefice not initialized. Call initialize() first.");
    }
    return settings;
  }

  public PortRegistry portRegistry() {
    return portRegistry;
  }

  public JobService jobService() {
    return jobService;
  }

  public SessionStore sessions() {
    return sessions;
  }

  public Authenticator authenticator() {
    return authenticator;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
