package org.waabox.satellite.shape;

import java.util.List;
import java.util.Objects;

/**
 * The upstream calls still owed after a reset or a restart.
 *
 * @param subscribe   the subscriptions to request again, never null
 * @param unsubscribe the server ids that still need an unsubscribe,
 *                    never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PendingActions(List<Resubscribe> subscribe,
    List<String> unsubscribe) {

  /** Compact constructor copying both lists. */
  public PendingActions {
    subscribe = List.copyOf(subscribe);
    unsubscribe = List.copyOf(unsubscribe);
  }

  /**
   * A subscription to request again under its previous key.
   *
   * @param key    the subscription key, never null
   * @param shapes the shapes, never null
   */
  public record Resubscribe(String key, List<Shape> shapes) {

    /** Compact constructor copying the shapes. */
    public Resubscribe {
      Objects.requireNonNull(key, "key must not be null");
      shapes = List.copyOf(shapes);
    }
  }
}
