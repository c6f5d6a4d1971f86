package com.gentoro.benefice.ports;

import com.gentoro.benefice.logging.LoggingService;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;

/**
 * Process-wide table of listen ports held by running workloads.
 *
 * <p>All mutations happen under the registry monitor and never span I/O. A reservation is
 * all-or-nothing: either every requested port becomes held by the caller, or none does and the
 * caller learns every port that was already taken.
 */
public class PortRegistry {
  private static final Logger log = LoggingService.getLogger(PortRegistry.class);

  private final Map<Integer, UUID> held = new HashMap<>();

  /**
   * Try to reserve {@code ports} for {@code holder}.
   *
   * @return the ports already held by other jobs; empty when the reservation succeeded
   */
  public synchronized SortedSet<Integer> tryReserve(UUID holder, Collection<Integer> ports) {
    SortedSet<Integer> conflicts = new TreeSet<>();
    for (Integer port : ports) {
      UUID owner = held.get(port);
      if (owner != null && !owner.equals(holder)) {
        conflicts.add(port);
      }
    }
    if (!conflicts.isEmpty()) {
      log.debug("Reservation for {} refused, ports {} already held", holder, conflicts);
      return conflicts;
    }
    for (Integer port : ports) {
      held.put(port, holder);
    }
    return conflicts;
  }

  /** Release the given ports held by {@code holder}. Ports held by someone else stay put. */
  public synchronized void release(UUID holder, Collection<Integer> ports) {
    for (Integer port : ports) {
      held.remove(port, holder);
    }
  }

  public synchronized Optional<UUID> holder(int port) {
    return Optional.ofNullable(held.get(port));
  }

  public synchronized int size() {
    return held.size();
  }
}
