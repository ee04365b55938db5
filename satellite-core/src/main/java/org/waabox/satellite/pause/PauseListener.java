package org.waabox.satellite.pause;

import java.util.Objects;

/**
 * Receives the transitions of a {@link PauseGate}.
 *
 * <p>Both callbacks run synchronously on the thread that caused the
 * transition, while the gate is locked.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface PauseListener {

  /** Invoked when the first reason is acquired; the stream must pause. */
  void onAcquired();

  /** Invoked when the last reason is released; the stream may resume. */
  void onReleased();

  /**
   * Creates a listener from two callbacks.
   *
   * @param onAcquired runs when the gate closes, never null
   * @param onReleased runs when the gate opens, never null
   *
   * @return the listener, never null
   */
  static PauseListener of(final Runnable onAcquired,
      final Runnable onReleased) {
    Objects.requireNonNull(onAcquired, "onAcquired must not be null");
    Objects.requireNonNull(onReleased, "onReleased must not be null");
    return new PauseListener() {
      @Override
      public void onAcquired() {
        onAcquired.run();
      }

      @Override
      public void onReleased() {
        onReleased.run();
      }
    };
  }
}
