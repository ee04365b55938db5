package org.waabox.satellite.pause;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PauseGate}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PauseGateTest {

  @Test
  void whenCreated_shouldBeOpen() {
    final PauseGate gate = new PauseGate(createMock(PauseListener.class));

    assertFalse(gate.isPaused());
    assertTrue(gate.holders().isEmpty());
  }

  @Test
  void whenAcquiring_givenOpenGate_shouldPauseOnce() {
    final PauseListener listener = createMock(PauseListener.class);
    listener.onAcquired();
    expectLastCall().once();
    replay(listener);

    final PauseGate gate = new PauseGate(listener);
    gate.acquire("visibility");
    gate.acquire("snapshot-1");

    assertTrue(gate.isPaused());
    assertTrue(gate.isHeldBy("visibility"));
    assertEquals(List.of("visibility", "snapshot-1"),
        List.copyOf(gate.holders()));
    verify(listener);
  }

  @Test
  void whenReleasing_givenSeveralReasons_shouldResumeOnlyAfterTheLast() {
    final PauseListener listener = createMock(PauseListener.class);
    listener.onAcquired();
    expectLastCall().once();
    listener.onReleased();
    expectLastCall().once();
    replay(listener);

    final PauseGate gate = new PauseGate(listener);
    gate.acquire("snapshot-1");
    gate.acquire("visibility");
    gate.release("snapshot-1");

    assertTrue(gate.isPaused());

    gate.release("visibility");

    assertFalse(gate.isPaused());
    verify(listener);
  }

  @Test
  void whenAcquiring_givenHeldReason_shouldNotNotifyAgain() {
    final PauseListener listener = createMock(PauseListener.class);
    listener.onAcquired();
    expectLastCall().once();
    replay(listener);

    final PauseGate gate = new PauseGate(listener);
    gate.acquire("visibility");
    gate.acquire("visibility");

    assertEquals(Set.of("visibility"), gate.holders());
    verify(listener);
  }

  @Test
  void whenReleasing_givenUnheldReason_shouldDoNothing() {
    final PauseListener listener = createMock(PauseListener.class);
    replay(listener);

    final PauseGate gate = new PauseGate(listener);
    gate.release("nonexistent");

    assertFalse(gate.isPaused());
    verify(listener);
  }

  @Test
  void whenReleasingAllMatching_givenMixedReasons_shouldKeepOthers() {
    final PauseListener listener = createMock(PauseListener.class);
    listener.onAcquired();
    expectLastCall().once();
    replay(listener);

    final PauseGate gate = new PauseGate(listener);
    gate.acquire("visibility");
    gate.acquire("snapshot-1");
    gate.acquire("snapshot-2");
    gate.releaseAllMatching("snapshot");

    assertTrue(gate.isPaused());
    assertTrue(gate.isHeldBy("visibility"));
    assertFalse(gate.isHeldBy("snapshot-1"));
    assertFalse(gate.isHeldBy("snapshot-2"));
    verify(listener);
  }

  @Test
  void whenReleasingAllMatching_givenOnlyMatching_shouldOpenSilently() {
    final PauseListener listener = createMock(PauseListener.class);
    listener.onAcquired();
    expectLastCall().times(2);
    replay(listener);

    final PauseGate gate = new PauseGate(listener);
    gate.acquire("snapshot-1");
    gate.acquire("snapshot-2");
    gate.releaseAllMatching("snapshot");

    assertFalse(gate.isPaused());

    gate.acquire("snapshot-3");

    assertTrue(gate.isPaused());
    verify(listener);
  }

  @Test
  void whenUsingCallbacks_givenAcquireAndRelease_shouldRunBoth() {
    final int[] calls = new int[2];
    final PauseGate gate = new PauseGate(PauseListener.of(
        () -> calls[0]++, () -> calls[1]++));

    gate.acquire("visibility");
    gate.release("visibility");

    assertEquals(1, calls[0]);
    assertEquals(1, calls[1]);
  }
}
