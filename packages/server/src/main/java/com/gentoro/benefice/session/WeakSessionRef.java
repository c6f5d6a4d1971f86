package com.gentoro.benefice.session;

import java.util.Optional;

/** Non-owning observer of a {@link SessionRef} value. */
public final class WeakSessionRef<T> {
  private final SessionRef.Shared<T> shared;

  WeakSessionRef(SessionRef.Shared<T> shared) {
    this.shared = shared;
  }

  /**
   * Obtain a new strong holder if any strong holder still exists. The returned reference must be
   * closed by the caller.
   */
  public Optional<SessionRef<T>> upgrade() {
    if (!shared.tryRetain()) {
      return Optional.empty();
    }
    return Optional.of(shared.newHandle());
  }

  boolean isAlive() {
    return shared.strong.get() > 0;
  }
}
