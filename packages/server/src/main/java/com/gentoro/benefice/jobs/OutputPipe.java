package com.gentoro.benefice.jobs;

import com.gentoro.benefice.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;

/**
 * Bounded byte FIFO between a process output stream and on-demand readers.
 *
 * <p>A pump thread copies the process stream in; {@link #read} hands out whatever is buffered,
 * waiting at most a caller-supplied deadline. When the buffer is full the pump blocks, which in
 * turn blocks the child on its pipe, exactly like an unread OS pipe would.
 */
final class OutputPipe {
  private static final Logger log = LoggingService.getLogger(OutputPipe.class);
  private static final int CHUNK = 4096;

  private final String label;
  private final byte[] ring;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition readable = lock.newCondition();
  private final Condition writable = lock.newCondition();

  private int head;
  private int size;
  private boolean eof;
  private boolean discarded;
  private IOException failure;

  OutputPipe(String label, int capacity) {
    this.label = label;
    this.ring = new byte[capacity];
  }

  /** Copy {@code in} into the pipe until end of stream, failure, or {@link #discard()}. */
  void pump(InputStream in) {
    byte[] chunk = new byte[CHUNK];
    try (in) {
      int n;
      while ((n = in.read(chunk)) != -1) {
        if (!offer(chunk, n)) break;
      }
    } catch (IOException e) {
      lock.lock();
      try {
        if (!discarded) {
          log.warn("Reading {} failed: {}", label, e.getMessage());
          failure = e;
        }
      } finally {
        lock.unlock();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      lock.lock();
      try {
        eof = true;
        readable.signalAll();
      } finally {
        lock.unlock();
      }
      log.trace("Pump for {} finished", label);
    }
  }

  private boolean offer(byte[] chunk, int n) throws InterruptedException {
    lock.lock();
    try {
      int offset = 0;
      while (offset < n) {
        while (size == ring.length && !discarded) {
          writable.await();
        }
        if (discarded) return false;
        int tail = (head + size) % ring.length;
        int count = Math.min(n - offset, Math.min(ring.length - size, ring.length - tail));
        System.arraycopy(chunk, offset, ring, tail, count);
        size += count;
        offset += count;
        readable.signalAll();
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Move up to {@code buffer.length} buffered bytes into {@code buffer}, waiting at most {@code
   * timeout} for the first byte.
   *
   * @return bytes copied; 0 when nothing arrived before the deadline or the stream has ended
   * @throws IOException when the underlying stream failed and nothing is left to hand out
   */
  int read(byte[] buffer, Duration timeout) throws IOException, InterruptedException {
    lock.lock();
    try {
      long nanos = timeout.toNanos();
      while (size == 0 && !eof && !discarded) {
        if (nanos <= 0) return 0;
        nanos = readable.awaitNanos(nanos);
      }
      if (size > 0) {
        int count = Math.min(buffer.length, size);
        int first = Math.min(count, ring.length - head);
        System.arraycopy(ring, head, buffer, 0, first);
        System.arraycopy(ring, 0, buffer, first, count - first);
        head = (head + count) % ring.length;
        size -= count;
        writable.signalAll();
        return count;
      }
      if (failure != null) {
        throw failure;
      }
      return 0;
    } finally {
      lock.unlock();
    }
  }

  /** True once the stream has ended and every buffered byte has been handed out. */
  boolean isDrained() {
    lock.lock();
    try {
      return size == 0 && (eof || discarded);
    } finally {
      lock.unlock();
    }
  }

  /** Drop buffered data and release a pump blocked on a full buffer. */
  void discard() {
    lock.lock();
    try {
      discarded = true;
      size = 0;
      readable.signalAll();
      writable.signalAll();
    } finally {
      lock.unlock();
    }
  }

  // visible for tests
  int buffered() {
    lock.lock();
    try {
      return size;
    } finally {
      lock.unlock();
    }
  }
}
