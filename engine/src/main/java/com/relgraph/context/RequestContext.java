package com.relgraph.context;

import com.google.common.base.MoreObjects;
import com.relgraph.model.EntityRef;
import java.util.Objects;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Per-call tenant and actor identity. Every service operation is scoped by this value; the
 * engine keeps no session state of its own.
 *
 * @param namespace The tenant namespace the call reads and writes
 * @param actorId Who performs the call, recorded on audit events
 * @param requestId Correlation id recorded on audit events
 * @param reason Free-text justification recorded on audit events
 * @param viewer The principal whose cross-namespace grants "shared with me" lists
 * @param platform Whether the caller may write the {@code global} hierarchy tier
 */
public record RequestContext(
    String namespace,
    @Nullable String actorId,
    String requestId,
    @Nullable String reason,
    @Nullable EntityRef viewer,
    boolean platform) {

  public RequestContext {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(requestId, "requestId");
  }

  /** A tenant context with a fresh request id and no actor. */
  public static RequestContext forTenant(String namespace) {
    return new RequestContext(namespace, null, UUID.randomUUID().toString(), null, null, false);
  }

  public RequestContext withActor(String newActorId) {
    return new RequestContext(namespace, newActorId, requestId, reason, viewer, platform);
  }

  public RequestContext withReason(String newReason) {
    return new RequestContext(namespace, actorId, requestId, newReason, viewer, platform);
  }

  public RequestContext withViewer(EntityRef newViewer) {
    return new RequestContext(namespace, actorId, requestId, reason, newViewer, platform);
  }

  /** Returns a copy allowed to write the {@code global} hierarchy tier. */
  public RequestContext asPlatform() {
    return new RequestContext(namespace, actorId, requestId, reason, viewer, true);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("namespace", namespace)
        .add("actorId", actorId)
        .add("requestId", requestId)
        .add("platform", platform)
        .omitNullValues()
        .toString();
  }
}
