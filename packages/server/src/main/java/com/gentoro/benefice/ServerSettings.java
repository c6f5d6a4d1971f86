package com.gentoro.benefice;

import com.gentoro.benefice.exception.ConfigException;
import com.gentoro.benefice.jobs.Limits;
import com.gentoro.benefice.ports.PortRange;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;
import org.apache.commons.lang3.StringUtils;

/** Typed, validated view of the configuration keys the server reads. */
public record ServerSettings(
    String hostname,
    int port,
    int maxJobs,
    String command,
    Path stagingDir,
    Limits limits,
    boolean sharedPortProtections,
    PortRange portRange,
    Duration readTimeout,
    Duration sessionIdleTimeout,
    String userHeader,
    String starredHeader) {

  public static ServerSettings from(Configuration config) {
    try {
      int maxJobs = config.getInt("jobs.max", Runtime.getRuntime().availableProcessors());
      if (maxJobs < 1) {
        throw new ConfigException("jobs.max must be at least 1, got " + maxJobs);
      }
      String staging = StringUtils.trimToNull(config.getString("jobs.staging-dir"));
      Limits limits =
          Limits.ofMebibytes(
              positive(config, "limits.size.default-mib", 10),
              positive(config, "limits.size.starred-mib", 50),
              Duration.ofSeconds(positive(config, "limits.timeout.default-seconds", 300)),
              Duration.ofSeconds(positive(config, "limits.timeout.starred-seconds", 900)));

      PortRange range;
      try {
        range = new PortRange(config.getInt("ports.min", 2000), config.getInt("ports.max", 30000));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid ports.min/ports.max", e);
      }

      return new ServerSettings(
          StringUtils.defaultIfBlank(config.getString("http.hostname"), "0.0.0.0").trim(),
          config.getInt("http.port", 3000),
          maxJobs,
          StringUtils.defaultIfBlank(config.getString("jobs.command"), "enarx"),
          staging == null ? Path.of(System.getProperty("java.io.tmpdir")) : Path.of(staging),
          limits,
          config.getBoolean("ports.shared-port-protections", true),
          range,
          Duration.ofMillis(positive(config, "output.read-timeout-ms", 500)),
          Duration.ofSeconds(positive(config, "sessions.idle-timeout-seconds", 86400)),
          StringUtils.defaultIfBlank(config.getString("auth.user-header"), "X-Benefice-User"),
          StringUtils.defaultIfBlank(
              config.getString("auth.starred-header"), "X-Benefice-Starred"));
    } catch (ConversionException e) {
      throw new ConfigException("Invalid configuration value: " + e.getMessage(), e);
    }
  }

  private static long positive(Configuration config, String key, long fallback) {
    long value = config.getLong(key, fallback);
    if (value <= 0) {
      throw new ConfigException("%s must be positive, got %d".formatted(key, value));
    }
    return value;
  }
}
