package com.gentoro.benefice.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.benefice.exception.Rejection;
import com.gentoro.benefice.exception.ValidationException;
import com.gentoro.benefice.ingest.UploadPart;
import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;

class MultipartUploadTest {

  private static final String BOUNDARY = "----benefice42";
  private static final String CONTENT_TYPE = "multipart/form-data; boundary=" + BOUNDARY;

  private static String part(String name, String contentType, String body) {
    return "--"
        + BOUNDARY
        + "\r\n"
        + "Content-Disposition: form-data; name=\""
        + name
        + "\"\r\n"
        + (contentType == null ? "" : "Content-Type: " + contentType + "\r\n")
        + "\r\n"
        + body
        + "\r\n";
  }

  private static String close() {
    return "--" + BOUNDARY + "--\r\n";
  }

  private static InputStream body(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  /** Hands out at most three bytes per read, so boundaries straddle reads. */
  private static InputStream trickle(String text) {
    return new FilterInputStream(body(text)) {
      @Override
      public int read(byte[] b, int off, int len) throws IOException {
        return super.read(b, off, Math.min(len, 3));
      }
    };
  }

  private static List<String> readAll(Iterable<UploadPart> parts) throws IOException {
    List<String> out = new ArrayList<>();
    for (UploadPart part : parts) {
      try (InputStream in = part.openStream()) {
        out.add(
            part.name()
                + "|"
                + part.contentType()
                + "|"
                + new String(in.readAllBytes(), StandardCharsets.UTF_8));
      }
    }
    return out;
  }

  @Test
  void partsComeOutInOrderWithHeaders() throws Exception {
    String text =
        part("wasm", "application/wasm", "\0asm") + part("toml", null, "[[files]]") + close();

    List<String> parts = readAll(MultipartUpload.of(CONTENT_TYPE, body(text), 1024));

    assertEquals(List.of("wasm|application/wasm|\0asm", "toml|null|[[files]]"), parts);
  }

  @Test
  void boundariesSplitAcrossReadsAreFound() throws Exception {
    String wasm = "x".repeat(5000) + "\r\n--" + "not-the-boundary";
    String text = part("wasm", "application/wasm", wasm) + part("toml", null, "") + close();

    List<String> parts = readAll(MultipartUpload.of(CONTENT_TYPE, trickle(text), 1 << 20));

    assertEquals(2, parts.size());
    assertEquals("wasm|application/wasm|" + wasm, parts.get(0));
    assertEquals("toml|null|", parts.get(1));
  }

  @Test
  void unreadPartsAreSkipped() throws Exception {
    String text =
        part("note", "text/plain", "ignore me " + "y".repeat(20_000))
            + part("toml", null, "a = 1")
            + close();

    Iterator<UploadPart> it = MultipartUpload.of(CONTENT_TYPE, body(text), 1 << 20).iterator();
    assertEquals("note", it.next().name());
    UploadPart toml = it.next();
    try (InputStream in = toml.openStream()) {
      assertEquals("a = 1", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
    assertFalse(it.hasNext());
  }

  @Test
  void streamOfAnEarlierPartEndsOnceTheNextPartIsTaken() throws Exception {
    String text = part("wasm", "application/wasm", "abc") + part("toml", null, "def") + close();

    Iterator<UploadPart> it = MultipartUpload.of(CONTENT_TYPE, body(text), 1024).iterator();
    InputStream first = it.next().openStream();
    UploadPart second = it.next();

    assertEquals(-1, first.read());
    try (InputStream in = second.openStream()) {
      assertEquals("def", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
  }

  @Test
  void truncatedBodyIsMalformed() {
    String text = part("wasm", "application/wasm", "abc");

    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> readAll(MultipartUpload.of(CONTENT_TYPE, body(text), 1024)));
    assertEquals(Rejection.MALFORMED_UPLOAD, e.reason());
  }

  @Test
  void bodyOverTheCapIsRejectedWhileReading() {
    String text = part("wasm", "application/wasm", "z".repeat(100_000)) + close();
    MultipartUpload upload = MultipartUpload.of(CONTENT_TYPE, body(text), 10_000);

    ValidationException e = assertThrows(ValidationException.class, () -> readAll(upload));

    assertEquals(Rejection.PAYLOAD_TOO_LARGE, e.reason());
    assertTrue(upload.received() < 20_000, "read " + upload.received() + " bytes");
  }

  @Test
  void nonMultipartContentTypeIsMalformed() {
    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> MultipartUpload.of("application/json", body("{}"), 1024));
    assertEquals(Rejection.MALFORMED_UPLOAD, e.reason());

    e =
        assertThrows(
            ValidationException.class,
            () -> MultipartUpload.of("multipart/form-data", body(""), 1024));
    assertEquals(Rejection.MALFORMED_UPLOAD, e.reason());
  }

  @Test
  void nothingIsReadBeforePartsAreRequested() {
    InputStream failing =
        new InputStream() {
          @Override
          public int read() {
            throw new AssertionError("body read too early");
          }
        };

    MultipartUpload upload = MultipartUpload.of(CONTENT_TYPE, failing, 1024);

    assertEquals(0, upload.received());
  }

  @Test
  void dispositionNameIgnoresFilename() {
    assertEquals(
        "wasm", MultipartUpload.dispositionName("form-data; filename=\"a.wasm\"; name=\"wasm\""));
    assertEquals("toml", MultipartUpload.dispositionName("form-data; name=toml"));
    assertNull(MultipartUpload.dispositionName("form-data"));
    assertNull(MultipartUpload.dispositionName(null));
  }
}
