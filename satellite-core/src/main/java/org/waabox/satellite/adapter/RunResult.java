package org.waabox.satellite.adapter;

/**
 * The outcome of a statement that modifies data.
 *
 * @param rowsAffected the number of rows modified, never negative
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RunResult(long rowsAffected) {

  /** Compact constructor rejecting negative counts. */
  public RunResult {
    if (rowsAffected < 0) {
      throw new IllegalArgumentException(
          "rowsAffected must not be negative, got: " + rowsAffected);
    }
  }
}
