package com.gentoro.benefice.jobs;

import java.time.Duration;

/** Upload size and time-to-live limits for the two quota tiers. */
public record Limits(
    long sizeDefaultBytes, long sizeStarredBytes, Duration ttlDefault, Duration ttlStarred) {

  private static final long MIB = 1024L * 1024L;

  public static Limits ofMebibytes(
      long sizeDefaultMib, long sizeStarredMib, Duration ttlDefault, Duration ttlStarred) {
    return new Limits(sizeDefaultMib * MIB, sizeStarredMib * MIB, ttlDefault, ttlStarred);
  }

  public Decision decide(boolean starred) {
    return starred
        ? new Decision(ttlStarred, sizeStarredBytes)
        : new Decision(ttlDefault, sizeDefaultBytes);
  }

  /** Limits that apply to one request. */
  public record Decision(Duration ttl, long sizeLimitBytes) {
    public long sizeLimitMib() {
      return sizeLimitBytes / MIB;
    }
  }
}
