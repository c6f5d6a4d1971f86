package com.gentoro.benefice.session;

import com.gentoro.benefice.exception.StateException;
import com.gentoro.benefice.logging.LoggingService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * Counted, lock-guarded handle to a shared value.
 *
 * <p>Each {@code SessionRef} instance is one strong holder; {@link #retain()} creates another and
 * {@link #close()} gives one up. When the last strong holder closes, the drop hook runs once and the
 * value becomes unreachable through any {@link WeakSessionRef}. Weak references never keep the
 * value alive; they can only be upgraded while some strong holder exists.
 *
 * <p>Access to the value goes through {@link #read} and {@link #write}, which hold the shared
 * read/write lock for the duration of the action.
 */
public final class SessionRef<T> implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(SessionRef.class);

  private final Shared<T> shared;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private SessionRef(Shared<T> shared) {
    this.shared = shared;
  }

  /** Create the first strong holder of {@code value}. */
  public static <T> SessionRef<T> of(T value, Consumer<? super T> onDrop) {
    return new SessionRef<>(new Shared<>(value, onDrop));
  }

  public static <T> SessionRef<T> of(T value) {
    return of(value, v -> {});
  }

  /** Another strong holder of the same value. The caller must close it. */
  public SessionRef<T> retain() {
    ensureOpen();
    shared.strong.incrementAndGet();
    return new SessionRef<>(shared);
  }

  /** A non-owning observer of the same value. */
  public WeakSessionRef<T> downgrade() {
    ensureOpen();
    return new WeakSessionRef<>(shared);
  }

  public <R, E extends Exception> R read(LockedAction<? super T, R, E> action) throws E {
    ensureOpen();
    shared.lock.readLock().lock();
    try {
      return action.apply(shared.value);
    } finally {
      shared.lock.readLock().unlock();
    }
  }

  public <R, E extends Exception> R write(LockedAction<? super T, R, E> action) throws E {
    ensureOpen();
    shared.lock.writeLock().lock();
    try {
      return action.apply(shared.value);
    } finally {
      shared.lock.writeLock().unlock();
    }
  }

  int strongCount() {
    return shared.strong.get();
  }

  boolean isClosed() {
    return closed.get();
  }

  /** Give up this strong hold. Idempotent per handle. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    if (shared.strong.decrementAndGet() == 0) {
      shared.drop();
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new StateException("Session reference already closed");
    }
  }

  /** State shared by all strong and weak handles of one value. */
  static final class Shared<T> {
    final AtomicInteger strong = new AtomicInteger(1);
    final ReadWriteLock lock = new ReentrantReadWriteLock();
    final T value;
    private final Consumer<? super T> onDrop;

    Shared(T value, Consumer<? super T> onDrop) {
      this.value = value;
      this.onDrop = onDrop;
    }

    /** Attempt to add a strong holder; fails once the count has reached zero. */
    boolean tryRetain() {
      while (true) {
        int current = strong.get();
        if (current == 0) return false;
        if (strong.compareAndSet(current, current + 1)) return true;
      }
    }

    SessionRef<T> newHandle() {
      return new SessionRef<>(this);
    }

    void drop() {
      lock.writeLock().lock();
      try {
        onDrop.accept(value);
      } catch (RuntimeException e) {
        log.warn("Drop hook failed for {}: {}", value, e.toString());
      } finally {
        lock.writeLock().unlock();
      }
    }
  }
}
