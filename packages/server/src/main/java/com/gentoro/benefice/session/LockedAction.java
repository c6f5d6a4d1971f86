package com.gentoro.benefice.session;

/** Work performed on a session's value while its lock is held. */
@FunctionalInterface
public interface LockedAction<T, R, E extends Exception> {
  R apply(T value) throws E;
}
