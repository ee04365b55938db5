package org.waabox.satellite;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.satellite.adapter.DatabaseAdapter;
import org.waabox.satellite.pause.PauseGate;
import org.waabox.satellite.pause.PauseListener;
import org.waabox.satellite.shape.ShapeSubscriptionManager;
import org.waabox.satellite.shape.SyncStatusListener;
import org.waabox.satellite.snapshot.SubscriptionSnapshot;
import org.waabox.satellite.snapshot.SubscriptionStateStore;

/**
 * One client session: the subscription manager, the local database adapter
 * and the pause gate that belong together.
 *
 * <p>A session is created through its {@link Builder}. When a
 * {@link SubscriptionStateStore} is configured, {@link #start()} restores
 * the subscriptions saved by a previous session with the same name and
 * {@link #stop()} saves the current ones, so they can be continued upstream
 * instead of being requested again.
 *
 * <pre>{@code
 * SatelliteSession session = SatelliteSession.builder()
 *     .name("app")
 *     .adapter(new BatchDatabaseAdapter(driver))
 *     .stateStore(new FileSystemSubscriptionStateStore(dir))
 *     .pauseListener(PauseListener.of(stream::pause, stream::resume))
 *     .build();
 * session.start();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SatelliteSession {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SatelliteSession.class);

  /** The default session name. */
  public static final String DEFAULT_NAME = "default";

  /** The session name, used as the state store entry. */
  private final String name;

  /** The subscription manager, never null. */
  private final ShapeSubscriptionManager subscriptions;

  /** The local database adapter, never null. */
  private final DatabaseAdapter adapter;

  /** The replication pause gate, never null. */
  private final PauseGate pauseGate;

  /** The optional state store, may be null. */
  private final SubscriptionStateStore stateStore;

  /** Whether start was called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether stop was called. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Creates a new session.
   *
   * @param theName          the session name, never null
   * @param theSubscriptions the subscription manager, never null
   * @param theAdapter       the database adapter, never null
   * @param thePauseGate     the pause gate, never null
   * @param theStateStore    the state store, may be null
   */
  private SatelliteSession(final String theName,
      final ShapeSubscriptionManager theSubscriptions,
      final DatabaseAdapter theAdapter, final PauseGate thePauseGate,
      final SubscriptionStateStore theStateStore) {
    name = theName;
    subscriptions = theSubscriptions;
    adapter = theAdapter;
    pauseGate = thePauseGate;
    stateStore = theStateStore;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the session, restoring the saved subscriptions if a state store
   * is configured and holds an entry for this session.
   *
   * @throws IllegalStateException if the session was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException(
          "Session '" + name + "' has already been started");
    }
    if (stateStore == null) {
      return;
    }
    final Optional<SubscriptionSnapshot> saved = stateStore.load(name);
    if (saved.isPresent()) {
      subscriptions.initialize(saved.get());
      log.info("Session '{}' restored {} subscriptions", name,
          saved.get().subscriptions().size());
    } else {
      log.debug("Session '{}' has no saved subscriptions", name);
    }
  }

  /**
   * Saves the active subscriptions to the state store, if any.
   */
  public void persist() {
    if (stateStore == null) {
      return;
    }
    final SubscriptionSnapshot snapshot = subscriptions.serialize();
    stateStore.save(name, snapshot);
    log.debug("Session '{}' saved {} subscriptions", name,
        snapshot.subscriptions().size());
  }

  /**
   * Stops the session, saving its subscriptions. Pending completions are
   * left untouched. Calling stop more than once has no effect.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    persist();
  }

  /**
   * Returns the session name.
   *
   * @return the name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Returns the subscription manager.
   *
   * @return the manager, never null
   */
  public ShapeSubscriptionManager subscriptions() {
    return subscriptions;
  }

  /**
   * Returns the local database adapter.
   *
   * @return the adapter, never null
   */
  public DatabaseAdapter adapter() {
    return adapter;
  }

  /**
   * Returns the replication pause gate.
   *
   * @return the gate, never null
   */
  public PauseGate pauseGate() {
    return pauseGate;
  }

  /**
   * Builder for {@link SatelliteSession}.
   *
   * <p>Only the adapter is required. Defaults:
   * <ul>
   *   <li>name: {@link SatelliteSession#DEFAULT_NAME}</li>
   *   <li>statusListener: none</li>
   *   <li>pauseListener: none</li>
   *   <li>stateStore: none, nothing survives the session</li>
   * </ul>
   */
  public static final class Builder {

    /** The optional session name. */
    private String name;

    /** The database adapter. */
    private DatabaseAdapter adapter;

    /** The optional status listener. */
    private SyncStatusListener statusListener;

    /** The optional pause listener. */
    private PauseListener pauseListener;

    /** The optional state store. */
    private SubscriptionStateStore stateStore;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the session name.
     *
     * @param theName the name, never null or empty
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theName is empty
     */
    public Builder name(final String theName) {
      Objects.requireNonNull(theName, "name must not be null");
      if (theName.isEmpty()) {
        throw new IllegalArgumentException("name must not be empty");
      }
      name = theName;
      return this;
    }

    /**
     * Sets the local database adapter.
     *
     * @param theAdapter the adapter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder adapter(final DatabaseAdapter theAdapter) {
      adapter = Objects.requireNonNull(theAdapter,
          "adapter must not be null");
      return this;
    }

    /**
     * Sets the listener notified of subscription status changes.
     *
     * @param theListener the listener, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder statusListener(final SyncStatusListener theListener) {
      statusListener = Objects.requireNonNull(theListener,
          "statusListener must not be null");
      return this;
    }

    /**
     * Sets the listener that pauses and resumes the replication stream.
     *
     * @param theListener the listener, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder pauseListener(final PauseListener theListener) {
      pauseListener = Objects.requireNonNull(theListener,
          "pauseListener must not be null");
      return this;
    }

    /**
     * Sets the store that keeps subscriptions across sessions.
     *
     * @param theStateStore the store, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder stateStore(final SubscriptionStateStore theStateStore) {
      stateStore = Objects.requireNonNull(theStateStore,
          "stateStore must not be null");
      return this;
    }

    /**
     * Builds the session.
     *
     * @return a new session, never null
     *
     * @throws IllegalStateException if no adapter was set
     */
    public SatelliteSession build() {
      if (adapter == null) {
        throw new IllegalStateException("adapter must be set");
      }
      final String resolvedName = name != null ? name : DEFAULT_NAME;
      final ShapeSubscriptionManager manager = statusListener != null
          ? new ShapeSubscriptionManager(statusListener)
          : new ShapeSubscriptionManager();
      final PauseListener resolvedPause = pauseListener != null
          ? pauseListener : PauseListener.of(() -> { }, () -> { });

      return new SatelliteSession(resolvedName, manager, adapter,
          new PauseGate(resolvedPause), stateStore);
    }
  }
}
