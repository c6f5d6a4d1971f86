package com.gentoro.benefice.session;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.benefice.exception.StateException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SessionRefTest {

  @Test
  void dropRunsOnceWhenLastStrongHolderCloses() {
    AtomicInteger drops = new AtomicInteger();
    SessionRef<String> first = SessionRef.of("value", v -> drops.incrementAndGet());
    SessionRef<String> second = first.retain();
    assertEquals(2, first.strongCount());

    first.close();
    assertEquals(0, drops.get());
    second.close();
    assertEquals(1, drops.get());
  }

  @Test
  void closeIsIdempotentPerHandle() {
    AtomicInteger drops = new AtomicInteger();
    SessionRef<String> first = SessionRef.of("value", v -> drops.incrementAndGet());
    SessionRef<String> second = first.retain();

    first.close();
    first.close();

    assertEquals(1, second.strongCount());
    assertEquals(0, drops.get());
    assertTrue(first.isClosed());
  }

  @Test
  void weakReferenceUpgradesWhileStrongHolderExists() {
    SessionRef<String> strong = SessionRef.of("value");
    WeakSessionRef<String> weak = strong.downgrade();

    try (SessionRef<String> upgraded = weak.upgrade().orElseThrow()) {
      assertEquals("value", upgraded.read(v -> v));
      assertEquals(2, strong.strongCount());
    }
    assertEquals(1, strong.strongCount());
  }

  @Test
  void weakReferenceDoesNotKeepValueAlive() {
    AtomicInteger drops = new AtomicInteger();
    SessionRef<String> strong = SessionRef.of("value", v -> drops.incrementAndGet());
    WeakSessionRef<String> weak = strong.downgrade();

    strong.close();

    assertEquals(1, drops.get());
    assertFalse(weak.isAlive());
    assertTrue(weak.upgrade().isEmpty());
  }

  @Test
  void upgradedReferenceDefersDrop() {
    AtomicInteger drops = new AtomicInteger();
    SessionRef<String> strong = SessionRef.of("value", v -> drops.incrementAndGet());
    SessionRef<String> upgraded = strong.downgrade().upgrade().orElseThrow();

    strong.close();
    assertEquals(0, drops.get());

    upgraded.close();
    assertEquals(1, drops.get());
  }

  @Test
  void closedHandleRefusesAccess() {
    SessionRef<String> strong = SessionRef.of("value");
    strong.close();
    assertThrows(StateException.class, () -> strong.read(v -> v));
    assertThrows(StateException.class, strong::retain);
  }

  @Test
  void failingDropHookDoesNotEscapeClose() {
    SessionRef<String> strong =
        SessionRef.of(
            "value",
            v -> {
              throw new IllegalStateException("boom");
            });
    assertDoesNotThrow(strong::close);
  }

  @Test
  void writeActionSeesSameValueAsRead() {
    StringBuilder value = new StringBuilder();
    try (SessionRef<StringBuilder> ref = SessionRef.of(value)) {
      ref.write(sb -> sb.append("x"));
      assertEquals("x", ref.read(StringBuilder::toString));
    }
  }
}
