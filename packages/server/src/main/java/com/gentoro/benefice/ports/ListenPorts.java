package com.gentoro.benefice.ports;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.gentoro.benefice.exception.Rejection;
import com.gentoro.benefice.exception.ValidationException;
import java.util.SortedSet;
import java.util.TreeSet;

/** Extracts the listen ports a workload configuration declares. */
public final class ListenPorts {
  private static final TomlMapper MAPPER = new TomlMapper();

  private ListenPorts() {}

  /**
   * Parse an Enarx.toml document and collect the {@code port} of every {@code kind = "listen"}
   * file entry.
   *
   * @throws ValidationException with {@link Rejection#MALFORMED_CONFIG} when the text is not valid
   *     TOML, a listen entry has no port, or a port is not a valid TCP/UDP port number
   */
  public static SortedSet<Integer> parse(String configText) {
    if (configText == null || configText.isBlank()) return new TreeSet<>();
    WorkloadConfig config;
    try {
      config = MAPPER.readValue(configText, WorkloadConfig.class);
    } catch (JacksonException e) {
      throw new ValidationException(
          Rejection.MALFORMED_CONFIG, "Invalid workload configuration: " + e.getOriginalMessage(), e);
    }

    SortedSet<Integer> ports = new TreeSet<>();
    if (config == null) return ports;
    for (WorkloadConfig.FileEntry file : config.getFiles()) {
      if (file == null || !file.isListen()) continue;
      Integer port = file.getPort();
      if (port == null) {
        throw new ValidationException(
            Rejection.MALFORMED_CONFIG,
            "Listen file '%s' does not declare a port".formatted(file.getName()));
      }
      if (port < 1 || port > 65535) {
        throw new ValidationException(
            Rejection.MALFORMED_CONFIG, "Listen port %d is not a valid port".formatted(port));
      }
      ports.add(port);
    }
    return ports;
  }
}
