package com.gentoro.benefice.ingest;

import com.gentoro.benefice.exception.IoException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The two staged files of one job request, in their own temporary directory. Closing deletes the
 * directory; closing again does nothing.
 */
public final class StagedArtifacts implements AutoCloseable {
  private final Path directory;
  private final Path workload;
  private final Path config;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public StagedArtifacts(Path directory, Path workload, Path config) {
    this.directory = directory;
    this.workload = workload;
    this.config = config;
  }

  public Path directory() {
    return directory;
  }

  public Path workload() {
    return workload;
  }

  public Path config() {
    return config;
  }

  public String readConfig() {
    try {
      return Files.readString(config, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read staged configuration " + config, e);
    }
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      IoUtil.silentDeleteDir(directory);
    }
  }
}
