package org.waabox.satellite.pause;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pauses the replication stream for as long as at least one named reason
 * holds it.
 *
 * <p>Independent subsystems pause for their own reasons, for example
 * {@code "visibility"} while the application is hidden or
 * {@code "snapshot-3"} while a snapshot is loaded. The listener's
 * {@link PauseListener#onAcquired()} fires when the first reason arrives
 * and {@link PauseListener#onReleased()} when the last one leaves, so the
 * stream never resumes while any subsystem still needs it paused.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PauseGate {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(PauseGate.class);

  /** The held reasons, in acquisition order; guarded by this. */
  private final Set<String> holders = new LinkedHashSet<>();

  /** The transition listener, never null. */
  private final PauseListener listener;

  /**
   * Creates an open gate.
   *
   * @param theListener the transition listener, never null
   */
  public PauseGate(final PauseListener theListener) {
    listener = Objects.requireNonNull(theListener,
        "listener must not be null");
  }

  /**
   * Holds the gate for the given reason.
   *
   * <p>Acquiring a reason that is already held logs a warning and changes
   * nothing.
   *
   * @param reason the reason, never null
   */
  public synchronized void acquire(final String reason) {
    Objects.requireNonNull(reason, "reason must not be null");
    final boolean wasPaused = !holders.isEmpty();
    if (!holders.add(reason)) {
      log.warn("Pause reason \"{}\" already held", reason);
      return;
    }
    log.debug("Pause acquired for \"{}\", holders: {}", reason, holders);
    if (!wasPaused) {
      listener.onAcquired();
    }
  }

  /**
   * Releases the given reason; releasing an unheld reason does nothing.
   *
   * @param reason the reason, never null
   */
  public synchronized void release(final String reason) {
    Objects.requireNonNull(reason, "reason must not be null");
    if (!holders.remove(reason)) {
      return;
    }
    log.debug("Pause released for \"{}\", holders: {}", reason, holders);
    if (holders.isEmpty()) {
      listener.onReleased();
    }
  }

  /**
   * Drops every reason starting with the given prefix without notifying
   * the listener.
   *
   * <p>Used when the stream is torn down, for example on reconnect, where
   * resuming is the caller's responsibility.
   *
   * @param prefix the reason prefix, never null
   */
  public synchronized void releaseAllMatching(final String prefix) {
    Objects.requireNonNull(prefix, "prefix must not be null");
    if (holders.removeIf(reason -> reason.startsWith(prefix))) {
      log.debug("Pause reasons matching \"{}\" dropped, holders: {}",
          prefix, holders);
    }
  }

  /**
   * Returns whether any reason holds the gate.
   *
   * @return true if paused
   */
  public synchronized boolean isPaused() {
    return !holders.isEmpty();
  }

  /**
   * Returns whether the given reason holds the gate.
   *
   * @param reason the reason, never null
   *
   * @return true if held by that reason
   */
  public synchronized boolean isHeldBy(final String reason) {
    return holders.contains(reason);
  }

  /**
   * Returns the reasons currently holding the gate.
   *
   * @return an unmodifiable copy, in acquisition order, never null
   */
  public synchronized Set<String> holders() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(holders));
  }
}
