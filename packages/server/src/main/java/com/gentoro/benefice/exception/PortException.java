package com.gentoro.benefice.exception;

import com.gentoro.benefice.ports.PortRange;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Declared listen ports are either outside the operator range or already held by another running
 * workload. Always carries the complete set of offending ports.
 */
public class PortException extends JobRejectedException {
  private final SortedSet<Integer> ports;
  private final PortRange range;

  private PortException(Rejection reason, String message, SortedSet<Integer> ports, PortRange range) {
    super(BeneficeErrorCode.RESOURCE_CONFLICT, reason, message);
    this.ports = Collections.unmodifiableSortedSet(new TreeSet<>(ports));
    this.range = range;
    withContext("ports", this.ports);
    if (range != null) {
      withContext("range", range.toString());
    }
  }

  public static PortException illegal(SortedSet<Integer> ports, PortRange range) {
    return new PortException(
        Rejection.ILLEGAL_PORTS,
        "Ports %s are outside of the allowed range %s".formatted(ports, range),
        ports,
        range);
  }

  public static PortException conflict(SortedSet<Integer> ports) {
    return new PortException(
        Rejection.PORT_CONFLICT,
        "Ports %s are already in use by another workload".formatted(ports),
        ports,
        null);
  }

  public SortedSet<Integer> ports() {
    return ports;
  }

  /** Allowed range, only set for {@link Rejection#ILLEGAL_PORTS}. */
  public PortRange range() {
    return range;
  }
}
