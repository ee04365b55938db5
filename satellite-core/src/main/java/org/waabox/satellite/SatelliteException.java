package org.waabox.satellite;

/**
 * Base exception for all Satellite-related errors.
 *
 * <p>This is an unchecked exception intended to wrap infrastructure failures
 * (storage drivers, snapshot encoding) that cannot be meaningfully recovered
 * from at the call site.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SatelliteException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public SatelliteException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public SatelliteException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
