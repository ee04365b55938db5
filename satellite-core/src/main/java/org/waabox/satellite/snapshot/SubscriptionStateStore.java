package org.waabox.satellite.snapshot;

import java.util.Optional;

/**
 * A persistent store for subscription snapshots.
 *
 * <p>Implementations define where snapshots are kept between process
 * restarts (local filesystem, a key-value table of the local database).
 * Sessions are identified by name so several sync sessions can share one
 * store.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SubscriptionStateStore {

  /**
   * Saves the snapshot of the given session.
   *
   * <p>If a snapshot already exists for the session, it is replaced.
   *
   * @param sessionName the name of the sync session, never null
   * @param snapshot    the snapshot to persist, never null
   */
  void save(String sessionName, SubscriptionSnapshot snapshot);

  /**
   * Loads the latest snapshot of the given session.
   *
   * @param sessionName the name of the sync session, never null
   * @return an optional containing the snapshot if one exists, or empty
   *         if nothing has been stored for this session
   */
  Optional<SubscriptionSnapshot> load(String sessionName);
}
