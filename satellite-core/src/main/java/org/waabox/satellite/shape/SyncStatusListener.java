package org.waabox.satellite.shape;

/**
 * A listener notified on every sync status transition of a subscription key.
 *
 * <p>Listeners are invoked synchronously by the
 * {@link ShapeSubscriptionManager} while it holds its internal lock.
 * Exceptions thrown by a listener are not caught and reach the caller of the
 * manager operation that triggered the transition.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface SyncStatusListener {

  /**
   * Called when the status of a key changes.
   *
   * @param key    the subscription key, never null
   * @param status the new status, or null once the key has no subscription
   *               left
   */
  void onStatusChanged(String key, SyncStatus status);
}
