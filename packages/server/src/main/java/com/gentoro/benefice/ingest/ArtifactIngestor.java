package com.gentoro.benefice.ingest;

import com.gentoro.benefice.exception.IoException;
import com.gentoro.benefice.exception.Rejection;
import com.gentoro.benefice.exception.ValidationException;
import com.gentoro.benefice.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;

/**
 * Streams the {@code wasm} and {@code toml} parts of a job request into a private staging
 * directory, enforcing shape and size rules while the bytes arrive.
 *
 * <ul>
 *   <li>{@code wasm}: content type {@value #WASM_CONTENT_TYPE}, exactly once, at most the caller's
 *       size limit
 *   <li>{@code toml}: no content type, exactly once, at most {@link #CONFIG_MAX_BYTES}
 *   <li>any other part is skipped
 * </ul>
 */
public final class ArtifactIngestor {
  private static final Logger log = LoggingService.getLogger(ArtifactIngestor.class);

  public static final String WORKLOAD_PART = "wasm";
  public static final String CONFIG_PART = "toml";
  public static final String WASM_CONTENT_TYPE = "application/wasm";
  public static final long CONFIG_MAX_BYTES = 256 * 1024;

  private final Path stagingRoot;

  public ArtifactIngestor(Path stagingRoot) {
    this.stagingRoot = stagingRoot;
  }

  /**
   * Stage both artifacts. Nothing is left on disk when this throws.
   *
   * @param workloadLimit maximum workload size in bytes for this caller
   */
  public StagedArtifacts ingest(Iterable<? extends UploadPart> parts, long workloadLimit) {
    Path dir;
    try {
      Files.createDirectories(stagingRoot);
      dir = Files.createTempDirectory(stagingRoot, "benefice-job-");
    } catch (IOException e) {
      throw new IoException("Failed to create staging directory under " + stagingRoot, e);
    }

    Path workload = null;
    Path config = null;
    try {
      for (UploadPart part : parts) {
        String name = part.name();
        if (WORKLOAD_PART.equals(name)) {
          if (!WASM_CONTENT_TYPE.equals(part.contentType())) {
            throw new ValidationException(
                Rejection.UNSUPPORTED_MEDIA_TYPE,
                "Workload must be uploaded as " + WASM_CONTENT_TYPE + ", got " + part.contentType());
          }
          if (workload != null) {
            throw new ValidationException(Rejection.MALFORMED_UPLOAD, "Duplicate workload part");
          }
          workload = stage(part, dir.resolve("workload.wasm"), workloadLimit);
        } else if (CONFIG_PART.equals(name)) {
          if (part.contentType() != null) {
            throw new ValidationException(
                Rejection.MALFORMED_UPLOAD, "Configuration part must not declare a content type");
          }
          if (config != null) {
            throw new ValidationException(Rejection.MALFORMED_UPLOAD, "Duplicate configuration part");
          }
          config = stage(part, dir.resolve("Enarx.toml"), CONFIG_MAX_BYTES);
        } else {
          log.trace("Ignoring upload part {}", name);
        }
      }

      if (workload == null) {
        throw new ValidationException(Rejection.MALFORMED_UPLOAD, "Missing workload part");
      }
      if (config == null) {
        throw new ValidationException(Rejection.MALFORMED_UPLOAD, "Missing configuration part");
      }
      return new StagedArtifacts(dir, workload, config);
    } catch (RuntimeException e) {
      IoUtil.silentDeleteDir(dir);
      throw e;
    }
  }

  private static Path stage(UploadPart part, Path dest, long limit) {
    try (InputStream in = part.openStream()) {
      long size = IoUtil.copyBounded(in, dest, limit, part.name());
      log.debug("Staged {} ({} bytes) at {}", part.name(), size, dest);
      return dest;
    } catch (IOException e) {
      throw new ValidationException(
          Rejection.MALFORMED_UPLOAD, "Could not open upload part " + part.name(), e);
    }
  }
}
