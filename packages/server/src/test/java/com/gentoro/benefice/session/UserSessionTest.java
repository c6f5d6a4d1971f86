package com.gentoro.benefice.session;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.benefice.jobs.Job;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class UserSessionTest {

  private final UserSession session = new UserSession("alice", false, Instant.now());

  private static Job job(boolean reaped, boolean drained) {
    Job job = mock(Job.class);
    when(job.id()).thenReturn(UUID.randomUUID());
    when(job.isReaped()).thenReturn(reaped);
    when(job.isDrained()).thenReturn(drained);
    return job;
  }

  @Test
  void emptySlotHasNoJob() {
    assertTrue(session.job().isEmpty());
    assertFalse(session.hasRunningJob());
  }

  @Test
  void installRefusesWhileJobRuns() {
    session.install(job(false, false));
    assertTrue(session.hasRunningJob());
    assertThrows(IllegalStateException.class, () -> session.install(job(false, false)));
  }

  @Test
  void exitedJobStaysVisibleUntilDrained() {
    Job exited = job(true, false);
    session.install(exited);

    assertFalse(session.hasRunningJob());
    assertSame(exited, session.job().orElseThrow());

    when(exited.isDrained()).thenReturn(true);
    assertTrue(session.job().isEmpty());
  }

  @Test
  void installReplacesLingeringFinishedJob() {
    Job exited = job(true, false);
    session.install(exited);
    Job next = job(false, false);

    session.install(next);

    verify(exited).kill();
    assertSame(next, session.job().orElseThrow());
  }

  @Test
  void killJobKillsAndEmptiesSlot() {
    Job running = job(false, false);
    session.install(running);

    assertSame(running, session.killJob().orElseThrow());

    verify(running).kill();
    assertTrue(session.job().isEmpty());
    assertTrue(session.killJob().isEmpty());
  }

  @Test
  void touchUpdatesTierAndLastSeen() {
    Instant later = Instant.now().plusSeconds(60);
    session.touch(later, true);
    assertTrue(session.starred());
    assertEquals(later, session.lastSeen());
  }
}
