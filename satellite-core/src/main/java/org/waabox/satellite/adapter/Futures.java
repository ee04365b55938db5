package org.waabox.satellite.adapter;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Helpers for working with completion exceptions. */
final class Futures {

  /** Private constructor to prevent instantiation. */
  private Futures() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Strips the wrappers added by {@link java.util.concurrent.CompletableFuture}
   * stages.
   *
   * @param error the error, never null
   *
   * @return the original cause, never null
   */
  static Throwable unwrap(final Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException
        || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
