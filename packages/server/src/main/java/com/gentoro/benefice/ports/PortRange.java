package com.gentoro.benefice.ports;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;

/** Inclusive range of listen ports a workload may declare. */
public record PortRange(int min, int max) {

  public PortRange {
    if (min < 1 || max > 65535 || min > max) {
      throw new IllegalArgumentException("Invalid port range %d-%d".formatted(min, max));
    }
  }

  public boolean contains(int port) {
    return port >= min && port <= max;
  }

  /** Every port of {@code ports} that falls outside this range, in ascending order. */
  public SortedSet<Integer> illegal(Collection<Integer> ports) {
    SortedSet<Integer> out = new TreeSet<>();
    for (Integer port : ports) {
      if (!contains(port)) out.add(port);
    }
    return out;
  }

  @Override
  public String toString() {
    return min + "-" + max;
  }
}
