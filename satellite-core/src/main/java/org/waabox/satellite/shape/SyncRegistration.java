package org.waabox.satellite.shape;

import java.util.Objects;

/**
 * The outcome of {@link ShapeSubscriptionManager#syncRequested}.
 *
 * <p>An <em>existing</em> registration means an identical request already
 * occupies the key: it exposes that request's completion and nothing else.
 * A <em>new</em> registration must be bound to the upstream handle with
 * {@link #setServerId(String)} once the upstream accepts the request, or
 * abandoned with {@link #syncFailed(Throwable)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncRegistration {

  /** The manager that owns the request. */
  private final ShapeSubscriptionManager manager;

  /** The subscription key, never null. */
  private final String key;

  /** The completion handle, never null. */
  private final SyncCompletion completion;

  /** The internal request id, or -1 for existing registrations. */
  private final long requestId;

  /**
   * Creates a registration.
   *
   * @param theManager    the owning manager, never null
   * @param theKey        the key, never null
   * @param theCompletion the completion, never null
   * @param theRequestId  the request id, -1 for an existing registration
   */
  SyncRegistration(final ShapeSubscriptionManager theManager,
      final String theKey, final SyncCompletion theCompletion,
      final long theRequestId) {
    manager = Objects.requireNonNull(theManager, "manager cannot be null");
    key = Objects.requireNonNull(theKey, "key cannot be null");
    completion = Objects.requireNonNull(theCompletion,
        "completion cannot be null");
    requestId = theRequestId;
  }

  /**
   * Returns the subscription key, generated when none was requested.
   *
   * @return the key, never null
   */
  public String key() {
    return key;
  }

  /**
   * Returns the completion handle of the request.
   *
   * <p>For an existing registration this is the same instance returned to
   * the caller that created the request.
   *
   * @return the completion, never null
   */
  public SyncCompletion completion() {
    return completion;
  }

  /**
   * Returns whether this registration reuses an identical request.
   *
   * @return true if no new request was created
   */
  public boolean isExisting() {
    return requestId < 0;
  }

  /**
   * Binds the request to the handle assigned by the upstream.
   *
   * @param serverId the upstream handle, never null
   *
   * @throws IllegalStateException if this is an existing registration, the
   *                               id was already set, or the request is no
   *                               longer tracked
   */
  public void setServerId(final String serverId) {
    Objects.requireNonNull(serverId, "serverId cannot be null");
    requireNew("setServerId");
    manager.assignServerId(requestId, serverId);
  }

  /**
   * Abandons the request after the upstream refused it or the call failed.
   *
   * @param cause the failure cause, never null
   *
   * @throws IllegalStateException if this is an existing registration
   */
  public void syncFailed(final Throwable cause) {
    Objects.requireNonNull(cause, "cause cannot be null");
    requireNew("syncFailed");
    manager.requestFailed(requestId, cause);
  }

  /**
   * Ensures this is a new registration.
   *
   * @param operation the attempted operation, for the error message
   */
  private void requireNew(final String operation) {
    if (isExisting()) {
      throw new IllegalStateException("Cannot call " + operation
          + " on an existing registration for key '" + key + "'");
    }
  }
}
