package com.gentoro.benefice.endpoints;

import com.gentoro.benefice.exception.Rejection;
import com.gentoro.benefice.exception.ValidationException;
import com.gentoro.benefice.ingest.UploadPart;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.jetty.http.MultiPart;
import org.eclipse.jetty.io.Content;

/**
 * Pulls the parts of a {@code multipart/form-data} body straight off the request stream.
 *
 * <p>Nothing is read before the caller asks for the next part or the next bytes of the current
 * one, and at most one read buffer of the body is held in memory. Parts the caller skips are
 * discarded as they go by. The body as a whole may not exceed {@code maxBytes}.
 *
 * <p>Single use: the parts can be iterated once, by one thread.
 */
final class MultipartUpload implements Iterable<UploadPart> {
  private static final int CHUNK = 8192;

  private final InputStream body;
  private final long maxBytes;
  private final MultiPart.Parser parser;
  private final Deque<Event> events = new ArrayDeque<>();
  private final byte[] buffer = new byte[CHUNK];

  private long received;
  private boolean eof;
  private boolean complete;
  private Throwable failure;
  private int partCount;
  private int currentPart = -1;
  private boolean iterated;

  private MultipartUpload(InputStream body, String boundary, long maxBytes) {
    this.body = body;
    this.maxBytes = maxBytes;
    this.parser = new MultiPart.Parser(boundary, new Listener());
  }

  /**
   * @throws ValidationException {@link Rejection#MALFORMED_UPLOAD} when {@code contentType} is not
   *     multipart/form-data with a boundary
   */
  static MultipartUpload of(String contentType, InputStream body, long maxBytes) {
    if (contentType == null || !contentType.toLowerCase().startsWith("multipart/form-data")) {
      throw new ValidationException(
          Rejection.MALFORMED_UPLOAD, "Expected a multipart/form-data upload");
    }
    String boundary = MultiPart.extractBoundary(contentType);
    if (StringUtils.isEmpty(boundary)) {
      throw new ValidationException(
          Rejection.MALFORMED_UPLOAD, "Multipart upload without a boundary");
    }
    return new MultipartUpload(body, boundary, maxBytes);
  }

  /** Bytes taken from the request body so far. */
  long received() {
    return received;
  }

  @Override
  public Iterator<UploadPart> iterator() {
    if (iterated) {
      throw new IllegalStateException("Multipart upload can only be read once");
    }
    iterated = true;
    return new PartIterator();
  }

  private void fill() {
    if (eof) {
      throw new ValidationException(
          Rejection.MALFORMED_UPLOAD, "Upload ended before the closing boundary");
    }
    int n;
    try {
      n = body.read(buffer);
    } catch (IOException e) {
      throw new ValidationException(Rejection.MALFORMED_UPLOAD, "Upload was interrupted", e);
    }
    if (n == -1) {
      eof = true;
      parser.parse(Content.Chunk.EOF);
    } else {
      received += n;
      if (received > maxBytes) {
        throw new ValidationException(
            Rejection.PAYLOAD_TOO_LARGE, "Upload exceeds %d bytes".formatted(maxBytes));
      }
      parser.parse(Content.Chunk.from(ByteBuffer.wrap(buffer, 0, n), false));
    }
    if (failure != null) {
      throw new ValidationException(
          Rejection.MALFORMED_UPLOAD,
          "Malformed multipart upload: " + failure.getMessage(),
          failure);
    }
  }

  /** Parameter {@code name} of a {@code Content-Disposition: form-data} header value. */
  static String dispositionName(String disposition) {
    if (disposition == null) return null;
    for (String param : disposition.split(";")) {
      String p = param.trim();
      if (p.regionMatches(true, 0, "name=", 0, 5)) {
        return StringUtils.unwrap(p.substring(5).trim(), '"');
      }
    }
    return null;
  }

  private interface Event {}

  private record PartStart(int index, String name, String contentType) implements Event {}

  private record PartBytes(byte[] bytes) implements Event {}

  private record PartEnd() implements Event {}

  private final class Listener implements MultiPart.Parser.Listener {
    private String disposition;
    private String contentType;

    @Override
    public void onPartBegin() {
      disposition = null;
      contentType = null;
    }

    @Override
    public void onPartHeader(String name, String value) {
      if ("Content-Disposition".equalsIgnoreCase(name)) {
        disposition = value;
      } else if ("Content-Type".equalsIgnoreCase(name)) {
        contentType = StringUtils.trimToNull(value);
      }
    }

    @Override
    public void onPartHeaders() {
      events.add(new PartStart(partCount++, dispositionName(disposition), contentType));
    }

    @Override
    public void onPartContent(Content.Chunk chunk) {
      ByteBuffer bytes = chunk.getByteBuffer().slice();
      if (bytes.hasRemaining()) {
        byte[] copy = new byte[bytes.remaining()];
        bytes.get(copy);
        events.add(new PartBytes(copy));
      }
    }

    @Override
    public void onPartEnd() {
      events.add(new PartEnd());
    }

    @Override
    public void onComplete() {
      complete = true;
    }

    @Override
    public void onFailure(Throwable cause) {
      failure = cause;
    }
  }

  private final class PartIterator implements Iterator<UploadPart> {
    @Override
    public boolean hasNext() {
      while (true) {
        Event head = events.peek();
        if (head instanceof PartStart) return true;
        if (head != null) {
          // leftovers of a part the caller did not read to the end
          events.poll();
        } else if (complete) {
          return false;
        } else {
          fill();
        }
      }
    }

    @Override
    public UploadPart next() {
      if (!hasNext()) throw new NoSuchElementException();
      PartStart start = (PartStart) events.poll();
      currentPart = start.index();
      return new StreamedPart(start);
    }
  }

  private final class StreamedPart implements UploadPart {
    private final PartStart start;
    private boolean opened;

    StreamedPart(PartStart start) {
      this.start = start;
    }

    @Override
    public String name() {
      return start.name();
    }

    @Override
    public String contentType() {
      return start.contentType();
    }

    @Override
    public InputStream openStream() throws IOException {
      if (opened) throw new IOException("Part " + start.name() + " was already opened");
      opened = true;
      return new PartStream(start.index());
    }
  }

  private final class PartStream extends InputStream {
    private final int index;
    private byte[] current;
    private int pos;
    private boolean ended;

    PartStream(int index) {
      this.index = index;
    }

    @Override
    public int read() throws IOException {
      byte[] one = new byte[1];
      int n = read(one, 0, 1);
      return n == -1 ? -1 : one[0] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      if (len == 0) return 0;
      while (current == null || pos == current.length) {
        if (ended || index != currentPart) return -1;
        Event head = events.peek();
        if (head instanceof PartBytes bytes) {
          events.poll();
          current = bytes.bytes();
          pos = 0;
        } else if (head instanceof PartEnd) {
          events.poll();
          ended = true;
        } else if (head instanceof PartStart || complete) {
          ended = true;
        } else {
          fill();
        }
      }
      int n = Math.min(len, current.length - pos);
      System.arraycopy(current, pos, b, off, n);
      pos += n;
      return n;
    }
  }
}
