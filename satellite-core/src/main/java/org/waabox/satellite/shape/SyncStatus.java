package org.waabox.satellite.shape;

import java.util.Objects;

/**
 * The synchronization status of a subscription key.
 *
 * <p>A key with no subscription has no status at all: listeners receive
 * {@code null} and {@link ShapeSubscriptionManager#status(String)} returns
 * an empty optional. Otherwise the status is one of {@link Establishing},
 * {@link Active} or {@link Cancelling}, visited in this order:
 *
 * <pre>
 * (none) -&gt; establishing(receiving_data) -&gt; active
 *   -&gt; [establishing(receiving_data, old) -&gt; establishing(removing_data)
 *       -&gt; active]*
 *   -&gt; cancelling -&gt; (none)
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SyncStatus {

  /**
   * Returns the server id of the subscription this status describes.
   *
   * @return the server id, never null
   */
  String serverId();

  /** The progress of an establishing subscription. */
  enum Progress {
    /** Waiting for the initial data of the new subscription. */
    RECEIVING_DATA,
    /** Data arrived, waiting for the overshadowed data to be removed. */
    REMOVING_DATA
  }

  /**
   * A subscription being established, possibly replacing an older one.
   *
   * @param progress    the progress, never null
   * @param serverId    the server id of the new subscription, never null
   * @param oldServerId the server id of the subscription being replaced,
   *                    may be null
   */
  record Establishing(Progress progress, String serverId,
      String oldServerId) implements SyncStatus {

    /** Compact constructor validating the required fields. */
    public Establishing {
      Objects.requireNonNull(progress, "progress must not be null");
      Objects.requireNonNull(serverId, "serverId must not be null");
    }
  }

  /**
   * A subscription whose data is fully synced.
   *
   * @param serverId the server id, never null
   */
  record Active(String serverId) implements SyncStatus {

    /** Compact constructor validating the server id. */
    public Active {
      Objects.requireNonNull(serverId, "serverId must not be null");
    }
  }

  /**
   * A subscription being torn down upstream.
   *
   * @param serverId the server id, never null
   */
  record Cancelling(String serverId) implements SyncStatus {

    /** Compact constructor validating the server id. */
    public Cancelling {
      Objects.requireNonNull(serverId, "serverId must not be null");
    }
  }
}
