package org.waabox.satellite.snapshot;

import java.util.List;
import java.util.Objects;

import org.waabox.satellite.shape.Shape;

/**
 * An established subscription that can be continued after a reconnect.
 *
 * @param serverId the server-assigned subscription id, never null
 * @param shapes   the shapes the subscription covers, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ContinuedSubscription(String serverId, List<Shape> shapes) {

  /** Compact constructor that validates and copies the shapes. */
  public ContinuedSubscription {
    Objects.requireNonNull(serverId, "serverId must not be null");
    Objects.requireNonNull(shapes, "shapes must not be null");
    shapes = List.copyOf(shapes);
  }
}
