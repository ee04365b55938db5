package org.waabox.satellite.shape;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SyncCompletion}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SyncCompletionTest {

  @Test
  void whenResolving_givenPending_shouldCompleteTheFuture() {
    final SyncCompletion completion = new SyncCompletion();
    final CompletableFuture<Void> future = completion.future();

    completion.resolve();

    assertEquals(SyncCompletion.State.RESOLVED, completion.state());
    assertTrue(future.isDone());
  }

  @Test
  void whenResolving_givenAlreadyFailed_shouldThrow() {
    final SyncCompletion completion = new SyncCompletion();
    completion.fail(new IllegalStateException("boom"));

    assertThrows(IllegalStateException.class, completion::resolve);
    assertEquals(SyncCompletion.State.FAILED, completion.state());
  }

  @Test
  void whenFailing_givenAlreadyResolved_shouldThrow() {
    final SyncCompletion completion = SyncCompletion.resolved();

    assertThrows(IllegalStateException.class,
        () -> completion.fail(new IllegalStateException("late")));
  }

  @Test
  void whenCompletingTheCopy_givenCallerFuture_shouldNotAffectTheHandle() {
    final SyncCompletion completion = new SyncCompletion();

    completion.future().complete(null);

    assertTrue(completion.isPending());
    assertTrue(!completion.future().isDone());
  }
}
