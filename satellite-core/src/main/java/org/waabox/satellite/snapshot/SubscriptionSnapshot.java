package org.waabox.satellite.snapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable projection of the subscriptions that are fully established,
 * keyed by subscription key.
 *
 * <p>Only active subscriptions are captured. Requests still waiting for data
 * and subscriptions being cancelled are left out and must be re-issued by
 * the caller after a reconnect.
 *
 * @param subscriptions the continued subscriptions by key, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SubscriptionSnapshot(
    Map<String, ContinuedSubscription> subscriptions) {

  /** Compact constructor that copies the map preserving its order. */
  public SubscriptionSnapshot {
    Objects.requireNonNull(subscriptions, "subscriptions must not be null");
    subscriptions = Collections.unmodifiableMap(
        new LinkedHashMap<>(subscriptions));
  }

  /**
   * Creates an empty snapshot.
   *
   * @return the empty snapshot, never null
   */
  public static SubscriptionSnapshot empty() {
    return new SubscriptionSnapshot(Map.of());
  }

  /**
   * Returns the server id of every continued subscription by key.
   *
   * @return an unmodifiable map of key to server id, never null
   */
  public Map<String, String> serverIdsByKey() {
    final Map<String, String> result = new LinkedHashMap<>();
    subscriptions.forEach((key, sub) -> result.put(key, sub.serverId()));
    return Collections.unmodifiableMap(result);
  }

  /**
   * Returns whether this snapshot holds no subscription.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return subscriptions.isEmpty();
  }
}
