package org.waabox.satellite.shape;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A resolve-once handle signalling that a sync request's data has fully
 * arrived.
 *
 * <p>The handle moves from {@link State#PENDING} to either
 * {@link State#RESOLVED} or {@link State#FAILED} exactly once. Any further
 * attempt to resolve or fail it is a logic error and raises an
 * {@link IllegalStateException}.
 *
 * <p>Callers observe the outcome through {@link #future()}, which returns a
 * dependent copy so that completing it has no effect on the handle.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncCompletion {

  /** The lifecycle of a completion handle. */
  public enum State {
    /** Data has not arrived yet. */
    PENDING,
    /** Data arrived. */
    RESOLVED,
    /** The request failed or was cancelled. */
    FAILED
  }

  /** The underlying future, completed only by this class. */
  private final CompletableFuture<Void> future = new CompletableFuture<>();

  /** The current state, guarded by this. */
  private State state = State.PENDING;

  /** Creates a pending completion. */
  SyncCompletion() {
  }

  /**
   * Creates a completion that is already resolved.
   *
   * @return the resolved completion, never null
   */
  static SyncCompletion resolved() {
    final SyncCompletion completion = new SyncCompletion();
    completion.resolve();
    return completion;
  }

  /**
   * Resolves this completion.
   *
   * @throws IllegalStateException if the completion is not pending
   */
  void resolve() {
    transition(State.RESOLVED);
    future.complete(null);
  }

  /**
   * Fails this completion with the given cause.
   *
   * @param cause the failure cause, never null
   *
   * @throws IllegalStateException if the completion is not pending
   */
  void fail(final Throwable cause) {
    Objects.requireNonNull(cause, "cause must not be null");
    transition(State.FAILED);
    future.completeExceptionally(cause);
  }

  /**
   * Returns the current state.
   *
   * @return the state, never null
   */
  public synchronized State state() {
    return state;
  }

  /**
   * Returns whether this completion is still pending.
   *
   * @return true if neither resolved nor failed
   */
  public boolean isPending() {
    return state() == State.PENDING;
  }

  /**
   * Returns a future completed when this handle is resolved or failed.
   *
   * @return a new dependent future, never null
   */
  public CompletableFuture<Void> future() {
    return future.copy();
  }

  /**
   * Moves the state out of pending.
   *
   * @param target the target state
   */
  private synchronized void transition(final State target) {
    if (state != State.PENDING) {
      throw new IllegalStateException(
          "Sync completion already " + state + ", cannot move to " + target);
    }
    state = target;
  }
}
