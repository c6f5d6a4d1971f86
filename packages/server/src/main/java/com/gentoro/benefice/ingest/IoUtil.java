package com.gentoro.benefice.ingest;

import com.gentoro.benefice.exception.IoException;
import com.gentoro.benefice.exception.Rejection;
import com.gentoro.benefice.exception.ValidationException;
import com.gentoro.benefice.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import org.slf4j.Logger;

/** Small collection of I/O helpers for staging uploads. */
public final class IoUtil {
  private static final Logger log = LoggingService.getLogger(IoUtil.class);
  private static final int CHUNK = 8192;

  private IoUtil() {}

  /**
   * Copy {@code in} to {@code dest}, failing as soon as more than {@code limit} bytes have arrived.
   * Never holds more than one chunk in memory.
   *
   * @return bytes written
   * @throws ValidationException {@link Rejection#PAYLOAD_TOO_LARGE} over the limit, {@link
   *     Rejection#MALFORMED_UPLOAD} when the upload stream breaks
   * @throws IoException when the destination cannot be written
   */
  public static long copyBounded(InputStream in, Path dest, long limit, String what) {
    byte[] chunk = new byte[CHUNK];
    long total = 0;
    try (OutputStream out = Files.newOutputStream(dest)) {
      while (true) {
        int n;
        try {
          n = in.read(chunk);
        } catch (IOException e) {
          throw new ValidationException(
              Rejection.MALFORMED_UPLOAD, "Upload of " + what + " was interrupted", e);
        }
        if (n == -1) break;
        total += n;
        if (total > limit) {
          throw new ValidationException(
              Rejection.PAYLOAD_TOO_LARGE, "%s exceeds %d bytes".formatted(what, limit));
        }
        out.write(chunk, 0, n);
      }
    } catch (IOException e) {
      throw new IoException("Failed to stage " + what + " at " + dest, e);
    }
    return total;
  }

  /** Delete a directory tree, logging anything that could not be removed. */
  public static void silentDeleteDir(Path dir) {
    if (dir == null || !Files.exists(dir)) return;

    try (var stream = Files.walk(dir)) {
      stream
          .sorted(Comparator.reverseOrder())
          .forEach(
              p -> {
                try {
                  Files.deleteIfExists(p);
                } catch (IOException e) {
                  log.debug("Could not delete {}: {}", p, e.getMessage());
                }
              });
    } catch (IOException e) {
      log.debug("Could not walk {}: {}", dir, e.getMessage());
    }
  }
}
