package org.waabox.satellite.shape;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.satellite.snapshot.ContinuedSubscription;
import org.waabox.satellite.snapshot.SubscriptionSnapshot;

/**
 * Tracks shape sync requests from the moment a caller asks for a shape until
 * the upstream removes it.
 *
 * <p>The manager is a pure in-memory state machine. It is driven by the
 * stream driver, which reports when the upstream accepted a request
 * ({@link SyncRegistration#setServerId(String)}), when its data arrived
 * ({@link #dataDelivered(String)}), when an unsubscribe was sent
 * ({@link #unsubscribeMade(Collection)}) and when the upstream finished
 * removing a subscription ({@link #goneBatchDelivered(Collection)}).
 *
 * <p>Each subscription key holds at most one <em>requested</em> request (sent
 * but without data yet) and one <em>active</em> one. Requesting different
 * shapes under an occupied key overshadows the previous request: the new
 * request's completion is resolved only after its own data arrived and every
 * overshadowed subscription is gone upstream. The overshadowed subscriptions
 * are not cancelled here; {@link #dataDelivered(String)} hands their server
 * ids back so the caller can unsubscribe them.
 *
 * <p>Status transitions are reported to an optional
 * {@link SyncStatusListener}. Identical consecutive statuses are reported
 * once.
 *
 * <p>Thread safety: every public method is mutually exclusive with the
 * others. Listener callbacks and completion dependents run on the calling
 * thread while the manager lock is held.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ShapeSubscriptionManager {

  /** Prefix of the keys generated for requests made without a key. */
  public static final String GENERATED_KEY_PREFIX = "~sync-";

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ShapeSubscriptionManager.class);

  /** The status listener, never null. */
  private final SyncStatusListener listener;

  /** Every tracked request, keyed by request id. */
  private final Map<Long, ShapeRequest> known = new HashMap<>();

  /** The latest requested, not yet delivered, request id per key. */
  private final Map<String, Long> requested = new LinkedHashMap<>();

  /** The active request id per key. */
  private final Map<String, Long> active = new LinkedHashMap<>();

  /** Request ids by server id. */
  private final Map<String, Long> serverIds = new HashMap<>();

  /** Server ids for which an unsubscribe was sent but not yet confirmed. */
  private final Set<String> incompleteUnsubscribes = new LinkedHashSet<>();

  /** Shapes to request again after a reset, keyed by subscription key. */
  private final Map<String, List<Shape>> unfulfilled = new LinkedHashMap<>();

  /** The last status reported to the listener per key. */
  private final Map<String, SyncStatus> lastReported = new HashMap<>();

  /** The next request id. */
  private long nextRequestId = 1;

  /** The next generated key suffix. */
  private long nextGeneratedKey = 1;

  /** Creates a manager that does not report status changes. */
  public ShapeSubscriptionManager() {
    this((key, status) -> { });
  }

  /**
   * Creates a manager.
   *
   * @param theListener the status listener, never null
   */
  public ShapeSubscriptionManager(final SyncStatusListener theListener) {
    listener = Objects.requireNonNull(theListener, "listener cannot be null");
  }

  /**
   * Registers a request to sync the given shapes.
   *
   * <p>This must be called before the upstream request is issued so that
   * concurrent identical calls are deduplicated:
   * <ul>
   *   <li>When the latest request under {@code key} has the same shapes,
   *       an existing registration sharing its completion is returned.</li>
   *   <li>Without a key, an existing registration is returned for the
   *       latest request under any key with the same shapes. Otherwise a
   *       key is generated with the {@link #GENERATED_KEY_PREFIX}.</li>
   *   <li>Otherwise a new request is created. If the key is occupied the
   *       new request overshadows the latest one.</li>
   * </ul>
   *
   * @param shapes the shapes to sync, never null or empty
   * @param key    the subscription key, may be null
   *
   * @return the registration, never null
   *
   * @throws IllegalArgumentException if shapes is empty or the key uses the
   *                                  reserved prefix
   */
  public synchronized SyncRegistration syncRequested(final List<Shape> shapes,
      final String key) {
    Objects.requireNonNull(shapes, "shapes must not be null");
    if (shapes.isEmpty()) {
      throw new IllegalArgumentException("shapes must not be empty");
    }
    if (key != null && key.startsWith(GENERATED_KEY_PREFIX)) {
      throw new IllegalArgumentException("Keys starting with '"
          + GENERATED_KEY_PREFIX + "' are reserved, got: " + key);
    }

    final String hash = ShapeHasher.hash(shapes);
    final String slot;
    final ShapeRequest latest;

    if (key == null) {
      final ShapeRequest duplicate = findLatestWithHash(hash);
      if (duplicate != null) {
        log.debug("Reusing request for key '{}' with identical shapes",
            duplicate.key);
        return existing(duplicate);
      }
      slot = generateKey();
      latest = null;
    } else {
      latest = latestFor(key);
      if (latest != null && latest.hash.equals(hash)) {
        return existing(latest);
      }
      slot = key;
    }

    final List<Long> overshadows = new ArrayList<>();
    if (latest != null) {
      // The most recent overshadowed request comes first.
      overshadows.add(latest.id);
      overshadows.addAll(latest.overshadows);
    }

    final ShapeRequest request = new ShapeRequest(nextRequestId++, slot,
        shapes, hash, overshadows, new SyncCompletion());
    known.put(request.id, request);
    requested.put(slot, request.id);
    unfulfilled.remove(slot);

    log.debug("Sync requested for key '{}' as request {}, overshadowing {}",
        slot, request.id, overshadows);

    return new SyncRegistration(this, slot, request.completion, request.id);
  }

  /**
   * Registers a request without a key.
   *
   * @param shapes the shapes to sync, never null or empty
   *
   * @return the registration, never null
   *
   * @see #syncRequested(List, String)
   */
  public SyncRegistration syncRequested(final List<Shape> shapes) {
    return syncRequested(shapes, null);
  }

  /**
   * Marks the data of a subscription as fully delivered.
   *
   * <p>The request becomes the active one for its key. The returned callback
   * must be invoked once the caller has recorded its own side effects:
   * <ul>
   *   <li>If the request overshadows nothing, the callback resolves its
   *       completion and returns an empty list.</li>
   *   <li>Otherwise the callback returns the server ids of the overshadowed
   *       subscriptions, which the caller must unsubscribe. The completion
   *       is resolved once all of them are reported gone.</li>
   * </ul>
   *
   * <p>Unknown server ids are logged and ignored.
   *
   * @param serverId the server id of the delivered subscription, never null
   *
   * @return the cleanup callback, never null
   */
  public synchronized Supplier<List<String>> dataDelivered(
      final String serverId) {
    Objects.requireNonNull(serverId, "serverId must not be null");

    final ShapeRequest request = byServerId(serverId);
    if (request == null) {
      log.warn("Data delivered for unknown subscription '{}', ignoring",
          serverId);
      return List::of;
    }

    final String key = request.key;
    if (Objects.equals(active.get(key), request.id)) {
      log.warn("Data delivered twice for subscription '{}', ignoring",
          serverId);
      return List::of;
    }

    if (Objects.equals(requested.get(key), request.id)) {
      requested.remove(key);
    } else if (isOvershadowed(request)) {
      // A newer request owns the key; this one only completes its caller.
      log.debug("Data delivered for overshadowed subscription '{}'",
          serverId);
      return () -> {
        resolve(request);
        return List.of();
      };
    }

    active.put(key, request.id);
    discardUnboundOvershadowed(request);

    if (request.overshadows.isEmpty()) {
      notifyStatus(key);
      return () -> {
        resolve(request);
        return List.of();
      };
    }

    final List<String> toUnsubscribe = new ArrayList<>();
    for (final Long id : request.overshadows) {
      toUnsubscribe.add(known.get(id).serverId);
    }
    log.debug("Subscription '{}' delivered, waiting for {} to be removed",
        serverId, toUnsubscribe);
    return () -> List.copyOf(toUnsubscribe);
  }

  /**
   * Records that an unsubscribe was sent upstream for the given server ids.
   *
   * <p>Nothing is resolved until {@link #goneBatchDelivered(Collection)}
   * confirms the removal.
   *
   * @param ids the unsubscribed server ids, never null
   */
  public synchronized void unsubscribeMade(final Collection<String> ids) {
    Objects.requireNonNull(ids, "ids must not be null");
    for (final String id : ids) {
      incompleteUnsubscribes.add(id);
      final ShapeRequest request = byServerId(id);
      if (request != null) {
        notifyStatus(request.key);
      }
    }
  }

  /**
   * Records that the upstream removed the given subscriptions.
   *
   * <p>Keys left without a subscription report a {@code null} status.
   * Requests waiting on these removals are resolved once nothing else is
   * left to remove. A removed request that never completed is failed with a
   * {@link CancellationException}. Unknown server ids are ignored.
   *
   * @param ids the removed server ids, never null
   */
  public synchronized void goneBatchDelivered(final Collection<String> ids) {
    Objects.requireNonNull(ids, "ids must not be null");
    for (final String id : ids) {
      incompleteUnsubscribes.remove(id);
      final Long requestId = serverIds.remove(id);
      if (requestId == null) {
        log.debug("Gone batch for unknown subscription '{}', ignoring", id);
        continue;
      }

      final ShapeRequest gone = known.remove(requestId);
      final String key = gone.key;
      active.remove(key, requestId);
      requested.remove(key, requestId);

      if (gone.completion.isPending()) {
        gone.completion.fail(new CancellationException(
            "Subscription '" + id + "' was removed before it completed"));
      }

      releaseWaiting(requestId);
      notifyStatus(key);
    }
  }

  /**
   * Fails the request bound to the given server id.
   *
   * <p>Used when the upstream reports an error for a subscription. The
   * request stops being tracked, and a request it overshadowed becomes the
   * latest for its key again if its data may still arrive.
   *
   * @param serverId the server id, never null
   * @param cause    the failure cause, never null
   */
  public synchronized void subscriptionFailed(final String serverId,
      final Throwable cause) {
    Objects.requireNonNull(serverId, "serverId must not be null");
    Objects.requireNonNull(cause, "cause must not be null");

    final ShapeRequest request = byServerId(serverId);
    if (request == null) {
      log.warn("Failure reported for unknown subscription '{}'", serverId,
          cause);
      return;
    }
    fail(request, cause);
  }

  /**
   * Returns the current status of a key.
   *
   * @param key the subscription key, never null
   *
   * @return the status, or empty if the key has no subscription
   */
  public synchronized Optional<SyncStatus> status(final String key) {
    Objects.requireNonNull(key, "key must not be null");
    return Optional.ofNullable(computeStatus(key));
  }

  /**
   * Returns the server ids of every active subscription.
   *
   * <p>These can be continued on reconnect without requesting them again.
   *
   * @return the server ids, never null
   */
  public synchronized List<String> listContinuedSubscriptions() {
    final List<String> result = new ArrayList<>();
    for (final Long id : active.values()) {
      result.add(known.get(id).serverId);
    }
    return result;
  }

  /**
   * Lists the upstream calls still owed, such as re-subscribes recorded by
   * {@link #reset(boolean, String)} or unsubscribes not yet confirmed.
   *
   * <p>Should be consulted after {@link #reset} and before any further sync
   * request.
   *
   * @return the pending actions, never null
   */
  public synchronized PendingActions listPendingActions() {
    final List<PendingActions.Resubscribe> subscribe = new ArrayList<>();
    unfulfilled.forEach((key, shapes) ->
        subscribe.add(new PendingActions.Resubscribe(key, shapes)));

    final Set<String> unsubscribe = new LinkedHashSet<>();
    for (final Long id : active.values()) {
      for (final Long overshadowed : known.get(id).overshadows) {
        unsubscribe.add(known.get(overshadowed).serverId);
      }
    }
    unsubscribe.addAll(incompleteUnsubscribes);

    return new PendingActions(subscribe, new ArrayList<>(unsubscribe));
  }

  /**
   * Captures the active, non-cancelling subscriptions.
   *
   * @return the snapshot, never null
   */
  public synchronized SubscriptionSnapshot serialize() {
    final Map<String, ContinuedSubscription> result = new LinkedHashMap<>();
    active.forEach((key, id) -> {
      final ShapeRequest request = known.get(id);
      if (!incompleteUnsubscribes.contains(request.serverId)) {
        result.put(key, new ContinuedSubscription(request.serverId,
            request.shapes));
      }
    });
    return new SubscriptionSnapshot(result);
  }

  /**
   * Replaces all state with the subscriptions of the given snapshot, each
   * one active with a resolved completion.
   *
   * <p>Requests that were in flight are dropped without being resolved;
   * callers re-issue them after reconnecting.
   *
   * @param snapshot the snapshot, never null
   */
  public synchronized void initialize(final SubscriptionSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot must not be null");
    clear();
    snapshot.subscriptions().forEach((key, sub) -> {
      final ShapeRequest request = new ShapeRequest(nextRequestId++, key,
          sub.shapes(), ShapeHasher.hash(sub.shapes()), new ArrayList<>(),
          SyncCompletion.resolved());
      request.serverId = sub.serverId();
      known.put(request.id, request);
      active.put(key, request.id);
      serverIds.put(sub.serverId(), request.id);
      lastReported.put(key, new SyncStatus.Active(sub.serverId()));
    });
    log.debug("Initialized with {} continued subscriptions", active.size());
  }

  /**
   * Resets the manager when the local store is reset.
   *
   * <p>Pending completions are failed with a {@link CancellationException}.
   * When {@code reestablish} is true the latest shapes of every key are kept
   * as re-subscribe actions, see {@link #listPendingActions()}.
   *
   * @param reestablish whether to keep the subscribed shapes for later
   * @param namespace   the namespace used to qualify table names, never null
   *
   * @return the tables touched by subscriptions that were not still
   *         requested, never null
   */
  public synchronized Set<QualifiedTablename> reset(final boolean reestablish,
      final String namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");

    final Set<QualifiedTablename> tables = new LinkedHashSet<>();
    for (final ShapeRequest request : known.values()) {
      if (!requested.containsValue(request.id)) {
        for (final Shape shape : request.shapes) {
          collectTables(shape, namespace, tables);
        }
      }
    }

    final Map<String, List<Shape>> toReestablish = new LinkedHashMap<>();
    if (reestablish) {
      unfulfilled.forEach(toReestablish::put);
      active.forEach((key, id) -> toReestablish.put(key, known.get(id).shapes));
      requested.forEach((key, id) ->
          toReestablish.put(key, known.get(id).shapes));
    }

    final List<ShapeRequest> dropped = new ArrayList<>(known.values());
    clear();
    for (final ShapeRequest request : dropped) {
      if (request.completion.isPending()) {
        request.completion.fail(new CancellationException(
            "Subscription state was reset"));
      }
    }

    unfulfilled.putAll(toReestablish);
    log.debug("Reset subscriptions, {} to re-establish", unfulfilled.size());
    return tables;
  }

  /**
   * Returns the key a server id belongs to.
   *
   * @param serverId the server id, never null
   *
   * @return the key, or empty if the server id is unknown
   */
  public synchronized Optional<String> keyForServerId(final String serverId) {
    final ShapeRequest request = byServerId(serverId);
    return request == null ? Optional.empty() : Optional.of(request.key);
  }

  /**
   * Returns the server ids of the active subscriptions of the given keys.
   *
   * @param keys the subscription keys, never null
   *
   * @return the server ids of the keys that are active, never null
   */
  public synchronized List<String> serverIdsForKeys(
      final Collection<String> keys) {
    final List<String> result = new ArrayList<>();
    for (final String key : keys) {
      final Long id = active.get(key);
      if (id != null) {
        result.add(known.get(id).serverId);
      }
    }
    return result;
  }

  /**
   * Returns the server ids of tracked requests for exactly these shapes.
   *
   * @param shapes the shapes, never null
   *
   * @return the server ids, never null
   */
  public synchronized List<String> serverIdsForShapes(
      final List<Shape> shapes) {
    final String hash = ShapeHasher.hash(shapes);
    final List<String> result = new ArrayList<>();
    for (final ShapeRequest request : known.values()) {
      if (request.hash.equals(hash) && request.serverId != null) {
        result.add(request.serverId);
      }
    }
    return result;
  }

  /**
   * Binds a request to its upstream handle and reports the establishing
   * status.
   *
   * @param requestId the request id
   * @param serverId  the server id, never null
   */
  synchronized void assignServerId(final long requestId,
      final String serverId) {
    final ShapeRequest request = known.get(requestId);
    if (request == null) {
      throw new IllegalStateException(
          "Request " + requestId + " is no longer tracked");
    }
    if (request.serverId != null) {
      throw new IllegalStateException("Request for key '" + request.key
          + "' is already bound to '" + request.serverId + "'");
    }
    if (serverIds.containsKey(serverId)) {
      throw new IllegalArgumentException(
          "Server id '" + serverId + "' is already bound to a request");
    }
    request.serverId = serverId;
    serverIds.put(serverId, requestId);
    notifyStatus(request.key);
  }

  /**
   * Fails a request registered by a caller.
   *
   * @param requestId the request id
   * @param cause     the failure cause, never null
   */
  synchronized void requestFailed(final long requestId,
      final Throwable cause) {
    final ShapeRequest request = known.get(requestId);
    if (request == null) {
      log.debug("Sync failure for untracked request {}", requestId);
      return;
    }
    fail(request, cause);
  }

  /**
   * Fails a request and stops tracking it.
   *
   * <p>If the request is the latest requested one for its key and the
   * request it overshadowed directly is not active, that request becomes the
   * latest again so the earlier sync call is not invalidated by this one.
   *
   * @param request the request, never null
   * @param cause   the failure cause, never null
   */
  private void fail(final ShapeRequest request, final Throwable cause) {
    if (request.completion.isPending()) {
      request.completion.fail(cause);
    }

    final String key = request.key;
    if (Objects.equals(requested.get(key), request.id)) {
      final Long shadowed = request.overshadows.isEmpty()
          ? null : request.overshadows.get(0);
      if (shadowed != null && known.containsKey(shadowed)
          && !Objects.equals(active.get(key), shadowed)) {
        requested.put(key, shadowed);
      } else {
        requested.remove(key);
      }
    }
    active.remove(key, request.id);

    known.remove(request.id);
    if (request.serverId != null) {
      serverIds.remove(request.serverId);
      incompleteUnsubscribes.remove(request.serverId);
    }
    releaseWaiting(request.id);
    notifyStatus(key);
  }

  /**
   * Removes a request that stopped being tracked from every overshadow
   * list, resolving the active requests that were waiting only on it.
   *
   * @param requestId the id of the request that is gone
   */
  private void releaseWaiting(final Long requestId) {
    final List<ShapeRequest> ready = new ArrayList<>();
    for (final ShapeRequest waiting : known.values()) {
      if (waiting.overshadows.remove(requestId)
          && waiting.overshadows.isEmpty()
          && Objects.equals(active.get(waiting.key), waiting.id)) {
        ready.add(waiting);
      }
    }
    ready.forEach(this::resolve);
  }

  /**
   * Drops overshadowed requests that never got a server id: nothing will
   * ever remove them upstream. Their callers are failed with a
   * {@link CancellationException}.
   *
   * @param request the delivered request, never null
   */
  private void discardUnboundOvershadowed(final ShapeRequest request) {
    final Iterator<Long> it = request.overshadows.iterator();
    while (it.hasNext()) {
      final ShapeRequest overshadowed = known.get(it.next());
      if (overshadowed == null) {
        it.remove();
      } else if (overshadowed.serverId == null) {
        it.remove();
        known.remove(overshadowed.id);
        if (overshadowed.completion.isPending()) {
          overshadowed.completion.fail(new CancellationException(
              "Request for key '" + overshadowed.key
                  + "' was overshadowed before the upstream accepted it"));
        }
      }
    }
  }

  /**
   * Resolves a request's completion unless it already completed.
   *
   * @param request the request, never null
   */
  private synchronized void resolve(final ShapeRequest request) {
    if (request.completion.isPending()) {
      request.completion.resolve();
    }
  }

  /**
   * Reports the status of a key if it differs from the last reported one.
   *
   * @param key the key, never null
   */
  private void notifyStatus(final String key) {
    final SyncStatus status = computeStatus(key);
    if (status == null) {
      if (lastReported.remove(key) != null) {
        listener.onStatusChanged(key, null);
      }
      return;
    }
    if (status.equals(lastReported.get(key))) {
      return;
    }
    lastReported.put(key, status);
    listener.onStatusChanged(key, status);
  }

  /**
   * Computes the status of a key from the requested and active requests.
   *
   * @param key the key, never null
   *
   * @return the status, or null if the key has no subscription
   */
  private SyncStatus computeStatus(final String key) {
    final ShapeRequest current = find(active.get(key));
    final ShapeRequest pending = find(requested.get(key));

    if (pending != null && pending.serverId != null) {
      return new SyncStatus.Establishing(SyncStatus.Progress.RECEIVING_DATA,
          pending.serverId, current == null ? null : current.serverId);
    }
    if (current == null) {
      return null;
    }
    if (!current.overshadows.isEmpty()) {
      return new SyncStatus.Establishing(SyncStatus.Progress.REMOVING_DATA,
          current.serverId, null);
    }
    if (incompleteUnsubscribes.contains(current.serverId)) {
      return new SyncStatus.Cancelling(current.serverId);
    }
    return new SyncStatus.Active(current.serverId);
  }

  /**
   * Returns the latest request of a key, requested first, active next.
   *
   * @param key the key, never null
   *
   * @return the request, or null
   */
  private ShapeRequest latestFor(final String key) {
    final Long id = requested.containsKey(key)
        ? requested.get(key) : active.get(key);
    return find(id);
  }

  /**
   * Finds the latest request of any key with the given shape hash.
   *
   * @param hash the shape hash, never null
   *
   * @return the request, or null
   */
  private ShapeRequest findLatestWithHash(final String hash) {
    final Set<String> keys = new LinkedHashSet<>(requested.keySet());
    keys.addAll(active.keySet());
    for (final String key : keys) {
      final ShapeRequest latest = latestFor(key);
      if (latest != null && latest.hash.equals(hash)) {
        return latest;
      }
    }
    return null;
  }

  /**
   * Returns whether a newer request overshadows the given one.
   *
   * @param request the request, never null
   *
   * @return true if overshadowed
   */
  private boolean isOvershadowed(final ShapeRequest request) {
    for (final ShapeRequest other : known.values()) {
      if (other.overshadows.contains(request.id)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Generates a key no caller can use.
   *
   * @return the key, never null
   */
  private String generateKey() {
    return GENERATED_KEY_PREFIX + nextGeneratedKey++;
  }

  /**
   * Builds an existing registration for a request.
   *
   * @param request the request, never null
   *
   * @return the registration, never null
   */
  private SyncRegistration existing(final ShapeRequest request) {
    return new SyncRegistration(this, request.key, request.completion, -1);
  }

  /**
   * Looks up a request by server id.
   *
   * @param serverId the server id
   *
   * @return the request, or null
   */
  private ShapeRequest byServerId(final String serverId) {
    return find(serverIds.get(serverId));
  }

  /**
   * Looks up a request by id.
   *
   * @param id the request id, may be null
   *
   * @return the request, or null
   */
  private ShapeRequest find(final Long id) {
    return id == null ? null : known.get(id);
  }

  /** Clears every piece of state except the id counters. */
  private void clear() {
    known.clear();
    requested.clear();
    active.clear();
    serverIds.clear();
    incompleteUnsubscribes.clear();
    unfulfilled.clear();
    lastReported.clear();
  }

  /**
   * Adds the table of a shape and of its includes.
   *
   * @param shape     the shape, never null
   * @param namespace the namespace, never null
   * @param tables    the target set, never null
   */
  private static void collectTables(final Shape shape, final String namespace,
      final Set<QualifiedTablename> tables) {
    for (final ShapeInclude include : shape.include()) {
      collectTables(include.select(), namespace, tables);
    }
    tables.add(new QualifiedTablename(namespace, shape.tablename()));
  }

  /** A request tracked by the manager. */
  private static final class ShapeRequest {

    /** The request id, unique for the manager's lifetime. */
    private final long id;

    /** The subscription key. */
    private final String key;

    /** The requested shapes. */
    private final List<Shape> shapes;

    /** The content hash of the shapes. */
    private final String hash;

    /** Ids of the overshadowed requests, most recent first. */
    private final List<Long> overshadows;

    /** The completion handed to the caller. */
    private final SyncCompletion completion;

    /** The upstream handle, null until assigned. */
    private String serverId;

    /**
     * Creates a request.
     *
     * @param theId          the id
     * @param theKey         the key
     * @param theShapes      the shapes
     * @param theHash        the shape hash
     * @param theOvershadows the overshadowed request ids
     * @param theCompletion  the completion
     */
    private ShapeRequest(final long theId, final String theKey,
        final List<Shape> theShapes, final String theHash,
        final List<Long> theOvershadows, final SyncCompletion theCompletion) {
      id = theId;
      key = theKey;
      shapes = List.copyOf(theShapes);
      hash = theHash;
      overshadows = theOvershadows;
      completion = theCompletion;
    }
  }
}
