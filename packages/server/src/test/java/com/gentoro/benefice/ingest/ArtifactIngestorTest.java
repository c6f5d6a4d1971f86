package com.gentoro.benefice.ingest;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.benefice.exception.Rejection;
import com.gentoro.benefice.exception.ValidationException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactIngestorTest {

  @TempDir Path temp;

  record Part(String name, String contentType, InputStream stream) implements UploadPart {
    static Part of(String name, String contentType, String data) {
      return new Part(
          name, contentType, new ByteArrayInputStream(data.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public InputStream openStream() {
      return stream;
    }
  }

  /** Produces bytes forever and counts how many were consumed. */
  static final class Endless extends InputStream {
    final AtomicLong served = new AtomicLong();

    @Override
    public int read() {
      served.incrementAndGet();
      return 'x';
    }

    @Override
    public int read(byte[] b, int off, int len) {
      served.addAndGet(len);
      return len;
    }
  }

  private ArtifactIngestor ingestor() {
    return new ArtifactIngestor(temp);
  }

  private long leftovers() throws Exception {
    try (Stream<Path> s = Files.list(temp)) {
      return s.count();
    }
  }

  private static Part wasm(String data) {
    return Part.of("wasm", "application/wasm", data);
  }

  private static Part toml(String data) {
    return Part.of("toml", null, data);
  }

  private void assertRejected(Rejection reason, List<Part> parts, long limit) throws Exception {
    ValidationException ex =
        assertThrows(ValidationException.class, () -> ingestor().ingest(parts, limit));
    assertEquals(reason, ex.reason());
    assertEquals(0, leftovers(), "staging directory must be removed");
  }

  @Test
  void stagesBothArtifacts() throws Exception {
    try (StagedArtifacts staged =
        ingestor().ingest(List.of(toml("[[files]]\n"), wasm("\0asm")), 1024)) {
      assertEquals("\0asm", Files.readString(staged.workload()));
      assertEquals("[[files]]\n", staged.readConfig());
      assertTrue(staged.directory().getFileName().toString().startsWith("benefice-job-"));
      assertEquals(staged.directory(), staged.config().getParent());
    }
    assertEquals(0, leftovers(), "closing removes the staging directory");
  }

  @Test
  void unrelatedPartsAreIgnored() throws Exception {
    try (StagedArtifacts staged =
        ingestor()
            .ingest(List.of(Part.of("note", "text/plain", "hi"), wasm("w"), toml("")), 1024)) {
      try (Stream<Path> files = Files.list(staged.directory())) {
        assertEquals(2, files.count());
      }
    }
  }

  @Test
  void wrongWorkloadContentTypeIsUnsupported() throws Exception {
    assertRejected(
        Rejection.UNSUPPORTED_MEDIA_TYPE,
        List.of(Part.of("wasm", "application/octet-stream", "w"), toml("")),
        1024);
    assertRejected(Rejection.UNSUPPORTED_MEDIA_TYPE, List.of(Part.of("wasm", null, "w")), 1024);
  }

  @Test
  void configWithContentTypeIsMalformed() throws Exception {
    assertRejected(
        Rejection.MALFORMED_UPLOAD, List.of(wasm("w"), Part.of("toml", "text/plain", "")), 1024);
  }

  @Test
  void duplicatePartsAreMalformed() throws Exception {
    assertRejected(Rejection.MALFORMED_UPLOAD, List.of(wasm("a"), wasm("b"), toml("")), 1024);
    assertRejected(Rejection.MALFORMED_UPLOAD, List.of(wasm("a"), toml(""), toml("")), 1024);
  }

  @Test
  void missingPartsAreMalformed() throws Exception {
    assertRejected(Rejection.MALFORMED_UPLOAD, List.of(toml("")), 1024);
    assertRejected(Rejection.MALFORMED_UPLOAD, List.of(wasm("w")), 1024);
    assertRejected(Rejection.MALFORMED_UPLOAD, List.of(), 1024);
  }

  @Test
  void oversizedWorkloadIsRejectedWithoutReadingItAll() throws Exception {
    Endless endless = new Endless();
    List<Part> parts = List.of(new Part("wasm", "application/wasm", endless), toml(""));

    assertRejected(Rejection.PAYLOAD_TOO_LARGE, parts, 10_000);
    assertTrue(endless.served.get() < 10_000 + 16 * 1024, "read " + endless.served.get());
  }

  @Test
  void workloadOfExactlyTheLimitIsAccepted() throws Exception {
    try (StagedArtifacts staged = ingestor().ingest(List.of(wasm("12345"), toml("")), 5)) {
      assertEquals(5, Files.size(staged.workload()));
    }
  }

  @Test
  void oversizedConfigIsRejected() throws Exception {
    String big = "#".repeat((int) ArtifactIngestor.CONFIG_MAX_BYTES + 1);
    assertRejected(Rejection.PAYLOAD_TOO_LARGE, List.of(wasm("w"), toml(big)), 1024);
  }
}
