package com.relgraph;

import com.google.common.collect.ImmutableList;
import com.relgraph.audit.AuditEvent;
import com.relgraph.audit.AuditEventType;
import com.relgraph.audit.AuditSink;
import com.relgraph.common.status.Status;
import com.relgraph.common.status.StatusOr;
import com.relgraph.config.EngineConfig;
import com.relgraph.context.RequestContext;
import com.relgraph.graph.CycleGuard;
import com.relgraph.graph.EntityLocks;
import com.relgraph.graph.GraphState;
import com.relgraph.graph.GraphStore;
import com.relgraph.graph.GraphStore.Mutation;
import com.relgraph.graph.HierarchyGraph;
import com.relgraph.graph.NamespaceGraph;
import com.relgraph.graph.PermissionClosure;
import com.relgraph.model.CyclePath;
import com.relgraph.model.EntityRef;
import com.relgraph.model.Explanation;
import com.relgraph.model.HierarchyRule;
import com.relgraph.model.NamespaceStats;
import com.relgraph.model.RelationTuple;
import com.relgraph.model.SubjectRef;
import com.relgraph.operations.NamespaceSyncOperation;
import com.relgraph.operations.NamespaceSyncOperation.SyncResult;
import com.relgraph.query.CheckEngine;
import com.relgraph.query.ListEngine;
import com.relgraph.security.ResourcePermissionChecker;
import com.relgraph.validation.Validators;
import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Library entry point of the permission graph engine.
 *
 * <p>Every method takes the caller's {@link RequestContext} and returns a {@link StatusOr}.
 * Expected failures come back as a status:
 *
 * <ul>
 *   <li>INVALID_ARGUMENT: malformed identifiers, namespace, ids or expiry, before any change
 *   <li>CYCLE_DETECTED / SELF_IMPLICATION: a structural write or rule that would close a cycle
 *   <li>NOT_FOUND / FAILED_PRECONDITION: explicit edge lookups such as extending an expiry
 *   <li>PERMISSION_DENIED: global rule writes without platform rights, or disabled "shared with
 *       me"
 *   <li>ABORTED: the write lost the commit race too many times
 *   <li>INTERNAL: anything unexpected
 * </ul>
 *
 * <p>Permission queries never fail because a relationship is missing; they answer false or
 * empty.
 */
public class AuthzServiceImpl {

  private static final Comparator<RelationTuple> GRANT_ORDER =
      Comparator.comparing((RelationTuple t) -> t.resource().type())
          .thenComparing(t -> t.resource().id())
          .thenComparing(RelationTuple::relation)
          .thenComparing(t -> t.subject().toString());

  private final Config config;
  private final GraphStore store;
  private final EntityLocks locks;
  private final CycleGuard cycleGuard;
  private final CheckEngine checkEngine;
  private final ListEngine listEngine;

  /**
   * @param engine Depth bounds, list limits and policies
   * @param auditSink Receives one event per committed change
   * @param clock Source of "now" for expiry decisions
   */
  public record Config(EngineConfig engine, AuditSink auditSink, Clock clock) {

    public static Config defaults() {
      return new Config(EngineConfig.defaults(), AuditSink.discarding(), Clock.systemUTC());
    }

    public static Config fromEnvironment(Map<String, String> env, AuditSink auditSink) {
      return new Config(EngineConfig.fromEnvironment(env), auditSink, Clock.systemUTC());
    }
  }

  public AuthzServiceImpl(Config config) {
    this.config = config;
    this.store = new GraphStore();
    this.locks = new EntityLocks();
    this.cycleGuard = new CycleGuard(config.engine());
    this.checkEngine = new CheckEngine(config.engine());
    this.listEngine = new ListEngine(config.engine());
  }

  public EngineConfig engineConfig() {
    return config.engine();
  }

  /** The current graph snapshot. */
  public GraphState snapshot() {
    return store.snapshot();
  }

  // ---------------------------------------------------------------------------
  // Relationship store
  // ---------------------------------------------------------------------------

  /**
   * Grants {@code relation} on {@code resource} to {@code subject}.
   *
   * <p>Granting an existing edge returns its id and replaces its expiry. {@code member} and
   * {@code parent} edges are checked for cycles while both endpoints are locked.
   *
   * @param expiresAt when the edge stops counting, or null for a permanent edge
   * @return the id of the new or existing edge
   */
  public StatusOr<Long> grant(
      RequestContext ctx,
      EntityRef resource,
      String relation,
      SubjectRef subject,
      @Nullable Instant expiresAt) {
    return guarded(
        "grant",
        () -> {
          Instant now = now();
          Status invalid =
              Validators.firstError(
                  tenantNamespace(ctx),
                  Validators.entity("resource", resource),
                  Validators.identifier("relation", relation),
                  Validators.subject(subject),
                  Validators.futureExpiry(expiresAt, now));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          String ns = ctx.namespace();
          boolean structural =
              RelationTuple.MEMBER.equals(relation) || RelationTuple.PARENT.equals(relation);
          if (!structural) {
            return insertOrUpdate(ctx, resource, relation, subject, expiresAt, now);
          }
          if (resource.equals(subject.entity())) {
            String message =
                RelationTuple.MEMBER.equals(relation)
                    ? "A group cannot be a member of itself: " + resource
                    : "A resource cannot be its own parent: " + resource;
            Logger.warn("Rejected grant in {}: {}", ns, message);
            return StatusOr.ofStatus(Status.cycleDetected(message));
          }
          try (EntityLocks.Held held = locks.acquire(ns, resource, subject.entity())) {
            return insertOrUpdate(ctx, resource, relation, subject, expiresAt, now);
          }
        });
  }

  private StatusOr<Long> insertOrUpdate(
      RequestContext ctx,
      EntityRef resource,
      String relation,
      SubjectRef subject,
      @Nullable Instant expiresAt,
      Instant now) {
    String ns = ctx.namespace();
    StatusOr<Mutation<Long>> committed =
        store.mutate(
            state -> {
              NamespaceGraph graph = state.namespace(ns);
              Optional<RelationTuple> existing = graph.find(resource, relation, subject);
              if (existing.isPresent()) {
                RelationTuple current = existing.get();
                if (Objects.equals(current.expiresAt(), expiresAt)) {
                  return StatusOr.ofValue(Mutation.unchanged(current.id()));
                }
                RelationTuple updated = current.withExpiresAt(expiresAt);
                return StatusOr.ofValue(
                    Mutation.commit(
                        state.with(ns, graph.edit().put(updated).build()),
                        current.id(),
                        List.of(
                            AuditEvent.forTuple(
                                AuditEventType.EXPIRATION_UPDATED, ctx, updated, now))));
              }
              RelationTuple tuple =
                  new RelationTuple(
                      store.nextId(), ns, resource, relation, subject, now, expiresAt);
              if (cycleGuard.wouldCreateCycle(graph, tuple)) {
                return StatusOr.ofStatus(Status.cycleDetected(cycleMessage(tuple)));
              }
              return StatusOr.ofValue(
                  Mutation.commit(
                      state.with(ns, graph.edit().put(tuple).build()),
                      tuple.id(),
                      List.of(AuditEvent.forTuple(AuditEventType.TUPLE_GRANTED, ctx, tuple, now))));
            });
    if (committed.isNotOk()) {
      Logger.warn(
          "Grant {}#{}@{} in {} rejected: {}",
          resource,
          relation,
          subject,
          ns,
          committed.getStatus());
    }
    return publish(committed);
  }

  private static String cycleMessage(RelationTuple tuple) {
    if (tuple.isMembership()) {
      return String.format(
          "Adding %s as a member of %s would create a cycle",
          tuple.subject().entity(), tuple.resource());
    }
    return String.format(
        "Setting %s as the parent of %s would create a cycle",
        tuple.subject().entity(), tuple.resource());
  }

  /**
   * Grants {@code relation} on {@code resource} to many subjects of one type in a single commit.
   *
   * <p>Parent edges and group-to-group membership edges are refused; they must go through
   * {@link #grant} one at a time. Existing edges are left untouched.
   *
   * @return the number of edges inserted
   */
  public StatusOr<Integer> grantBulk(
      RequestContext ctx,
      EntityRef resource,
      String relation,
      String subjectType,
      List<String> subjectIds) {
    return guarded(
        "grantBulk",
        () -> {
          Status invalid =
              Validators.firstError(
                  tenantNamespace(ctx),
                  Validators.entity("resource", resource),
                  Validators.identifier("relation", relation),
                  Validators.identifier("subject type", subjectType),
                  Validators.ids("subject_ids", subjectIds));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          if (RelationTuple.PARENT.equals(relation)) {
            return StatusOr.ofStatus(
                Status.invalidArgument("Bulk grants cannot create parent edges; use grant"));
          }
          if (RelationTuple.MEMBER.equals(relation)
              && !subjectType.equals(config.engine().userSubjectType())) {
            return StatusOr.ofStatus(
                Status.invalidArgument(
                    "Bulk grants cannot nest groups (subject type "
                        + subjectType
                        + "); use grant"));
          }
          String ns = ctx.namespace();
          Instant now = now();
          Set<String> distinctIds = new LinkedHashSet<>(subjectIds);
          StatusOr<Mutation<Integer>> committed =
              store.mutate(
                  state -> {
                    NamespaceGraph graph = state.namespace(ns);
                    NamespaceGraph.Editor editor = graph.edit();
                    List<AuditEvent> events = new ArrayList<>();
                    for (String id : distinctIds) {
                      SubjectRef subject = SubjectRef.of(subjectType, id);
                      if (graph.find(resource, relation, subject).isPresent()) {
                        continue;
                      }
                      RelationTuple tuple =
                          new RelationTuple(
                              store.nextId(), ns, resource, relation, subject, now, null);
                      if (resource.equals(subject.entity())
                          || cycleGuard.wouldCreateCycle(graph, tuple)) {
                        return StatusOr.ofStatus(Status.cycleDetected(cycleMessage(tuple)));
                      }
                      editor.put(tuple);
                      events.add(
                          AuditEvent.forTuple(AuditEventType.TUPLE_GRANTED, ctx, tuple, now));
                    }
                    if (events.isEmpty()) {
                      return StatusOr.ofValue(Mutation.unchanged(0));
                    }
                    return StatusOr.ofValue(
                        Mutation.commit(state.with(ns, editor.build()), events.size(), events));
                  });
          StatusOr<Integer> result = publish(committed);
          if (result.isOk()) {
            Logger.info(
                "Bulk granted {}#{} to {} of {} {} subjects in {}",
                resource,
                relation,
                result.getValue(),
                distinctIds.size(),
                subjectType,
                ns);
          }
          return result;
        });
  }

  /**
   * Removes one edge.
   *
   * @return true if the edge existed (expired edges included)
   */
  public StatusOr<Boolean> revoke(
      RequestContext ctx, EntityRef resource, String relation, SubjectRef subject) {
    return guarded(
        "revoke",
        () -> {
          Status invalid =
              Validators.firstError(
                  tenantNamespace(ctx),
                  Validators.entity("resource", resource),
                  Validators.identifier("relation", relation),
                  Validators.subject(subject));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          String ns = ctx.namespace();
          Instant now = now();
          return publish(
              store.mutate(
                  state -> {
                    NamespaceGraph graph = state.namespace(ns);
                    Optional<RelationTuple> existing = graph.find(resource, relation, subject);
                    if (existing.isEmpty()) {
                      return StatusOr.ofValue(Mutation.unchanged(false));
                    }
                    return StatusOr.ofValue(
                        Mutation.commit(
                            state.with(ns, graph.edit().remove(existing.get()).build()),
                            true,
                            List.of(
                                AuditEvent.forTuple(
                                    AuditEventType.TUPLE_REVOKED, ctx, existing.get(), now))));
                  }));
        });
  }

  /**
   * Removes every edge whose subject entity is {@code subject}, with or without a subject
   * relation, optionally only on resources of {@code resourceType}.
   *
   * @return the number of edges removed
   */
  public StatusOr<Integer> revokeSubjectGrants(
      RequestContext ctx, EntityRef subject, @Nullable String resourceType) {
    return guarded(
        "revokeSubjectGrants",
        () -> {
          Status invalid =
              Validators.firstError(
                  tenantNamespace(ctx),
                  Validators.entity("subject", subject),
                  resourceType == null
                      ? Status.ok()
                      : Validators.identifier("resource type", resourceType));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          StatusOr<Integer> result =
              removeWhere(
                  ctx,
                  AuditEventType.TUPLE_REVOKED,
                  graph -> graph.edgesFrom(subject).stream(),
                  t -> resourceType == null || t.resource().type().equals(resourceType));
          if (result.isOk()) {
            Logger.info(
                "Revoked {} grants of {} in {}", result.getValue(), subject, ctx.namespace());
          }
          return result;
        });
  }

  /**
   * Removes every edge on {@code resource}, optionally only those granting {@code relation}.
   *
   * @return the number of edges removed
   */
  public StatusOr<Integer> revokeResourceGrants(
      RequestContext ctx, EntityRef resource, @Nullable String relation) {
    return guarded(
        "revokeResourceGrants",
        () -> {
          Status invalid =
              Validators.firstError(
                  tenantNamespace(ctx),
                  Validators.entity("resource", resource),
                  relation == null ? Status.ok() : Validators.identifier("relation", relation));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          StatusOr<Integer> result =
              removeWhere(
                  ctx,
                  AuditEventType.TUPLE_REVOKED,
                  graph -> graph.edgesOn(resource),
                  t -> relation == null || t.relation().equals(relation));
          if (result.isOk()) {
            Logger.info(
                "Revoked {} grants on {} in {}", result.getValue(), resource, ctx.namespace());
          }
          return result;
        });
  }

  private StatusOr<Integer> removeWhere(
      RequestContext ctx,
      AuditEventType eventType,
      Function<NamespaceGraph, Stream<RelationTuple>> source,
      Predicate<RelationTuple> filter) {
    String ns = ctx.namespace();
    Instant now = now();
    return publish(
        store.mutate(
            state -> {
              NamespaceGraph graph = state.namespace(ns);
              List<RelationTuple> doomed =
                  source.apply(graph).filter(filter).collect(Collectors.toList());
              if (doomed.isEmpty()) {
                return StatusOr.ofValue(Mutation.unchanged(0));
              }
              List<AuditEvent> events =
                  doomed.stream()
                      .map(t -> AuditEvent.forTuple(eventType, ctx, t, now))
                      .collect(Collectors.toList());
              return StatusOr.ofValue(
                  Mutation.commit(
                      state.with(ns, graph.edit().removeAll(doomed).build()),
                      doomed.size(),
                      events));
            }));
  }

  /**
   * Live edges whose subject entity is {@code subject}, ordered by resource type, resource id
   * and relation.
   */
  public StatusOr<List<RelationTuple>> listSubjectGrants(
      RequestContext ctx, EntityRef subject, @Nullable String resourceType) {
    return guarded(
        "listSubjectGrants",
        () -> {
          Status invalid =
              Validators.firstError(
                  Validators.namespace(ctx.namespace()),
                  Validators.entity("subject", subject),
                  resourceType == null
                      ? Status.ok()
                      : Validators.identifier("resource type", resourceType));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          Instant now = now();
          return StatusOr.ofValue(
              store.snapshot().namespace(ctx.namespace()).edgesFrom(subject).stream()
                  .filter(t -> t.isLive(now))
                  .filter(t -> resourceType == null || t.resource().type().equals(resourceType))
                  .sorted(GRANT_ORDER)
                  .collect(ImmutableList.toImmutableList()));
        });
  }

  /**
   * Live edges in every namespace that name the context's viewer as a plain subject. Requires
   * recipient visibility to be enabled.
   */
  public StatusOr<List<RelationTuple>> listSharedWithMe(RequestContext ctx) {
    return guarded(
        "listSharedWithMe",
        () -> {
          EntityRef viewer = ctx.viewer();
          if (viewer == null) {
            return StatusOr.ofStatus(
                Status.invalidArgument("Shared-with-me requires a viewer in the request context"));
          }
          Status invalid = Validators.entity("viewer", viewer);
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          if (!config.engine().recipientVisibility()) {
            return StatusOr.ofStatus(
                Status.permissionDenied("Recipient visibility is disabled"));
          }
          Instant now = now();
          GraphState state = store.snapshot();
          ImmutableList.Builder<RelationTuple> shared = ImmutableList.builder();
          for (String ns : state.tenantNamespaces()) {
            state.namespace(ns).edgesFrom(viewer).stream()
                .filter(t -> !t.subject().isUserset() && t.isLive(now))
                .sorted(GRANT_ORDER)
                .forEach(shared::add);
          }
          return StatusOr.ofValue(shared.build());
        });
  }

  // ---------------------------------------------------------------------------
  // Expiration management
  // ---------------------------------------------------------------------------

  /**
   * Sets or clears the expiry of an existing edge.
   *
   * @param expiresAt a future instant, or null to make the edge permanent
   * @return false if the edge does not exist
   */
  public StatusOr<Boolean> setExpiration(
      RequestContext ctx,
      EntityRef resource,
      String relation,
      SubjectRef subject,
      @Nullable Instant expiresAt) {
    return guarded(
        "setExpiration",
        () -> {
          Instant now = now();
          Status invalid =
              Validators.firstError(
                  tenantNamespace(ctx),
                  Validators.entity("resource", resource),
                  Validators.identifier("relation", relation),
                  Validators.subject(subject),
                  Validators.futureExpiry(expiresAt, now));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          String ns = ctx.namespace();
          return publish(
              store.mutate(
                  state -> {
                    NamespaceGraph graph = state.namespace(ns);
                    Optional<RelationTuple> existing = graph.find(resource, relation, subject);
                    if (existing.isEmpty()) {
                      return StatusOr.ofValue(Mutation.unchanged(false));
                    }
                    if (Objects.equals(existing.get().expiresAt(), expiresAt)) {
                      return StatusOr.ofValue(Mutation.unchanged(true));
                    }
                    RelationTuple updated = existing.get().withExpiresAt(expiresAt);
                    return StatusOr.ofValue(
                        Mutation.commit(
                            state.with(ns, graph.edit().put(updated).build()),
                            true,
                            List.of(
                                AuditEvent.forTuple(
                                    AuditEventType.EXPIRATION_UPDATED, ctx, updated, now))));
                  }));
        });
  }

  /** Makes an existing edge permanent. */
  public StatusOr<Boolean> clearExpiration(
      RequestContext ctx, EntityRef resource, String relation, SubjectRef subject) {
    return setExpiration(ctx, resource, relation, subject, null);
  }

  /**
   * Pushes an edge's expiry out by {@code extension}. An edge that already expired is extended
   * from now.
   *
   * @return the new expiry; NOT_FOUND if the edge is missing, FAILED_PRECONDITION if it never
   *     expires
   */
  public StatusOr<Instant> extendExpiration(
      RequestContext ctx,
      EntityRef resource,
      String relation,
      SubjectRef subject,
      Duration extension) {
    return guarded(
        "extendExpiration",
        () -> {
          Status invalid =
              Validators.firstError(
                  tenantNamespace(ctx),
                  Validators.entity("resource", resource),
                  Validators.identifier("relation", relation),
                  Validators.subject(subject));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          if (extension == null || extension.isNegative() || extension.isZero()) {
            return StatusOr.ofStatus(Status.invalidArgument("extension must be positive"));
          }
          String ns = ctx.namespace();
          Instant now = now();
          return publish(
              store.mutate(
                  state -> {
                    NamespaceGraph graph = state.namespace(ns);
                    Optional<RelationTuple> existing = graph.find(resource, relation, subject);
                    if (existing.isEmpty()) {
                      return StatusOr.ofStatus(
                          Status.notFound(
                              String.format(
                                  "No edge %s#%s@%s in %s", resource, relation, subject, ns)));
                    }
                    Instant current = existing.get().expiresAt();
                    if (current == null) {
                      return StatusOr.ofStatus(
                          Status.failedPrecondition(
                              "Edge " + existing.get() + " has no expiration to extend"));
                    }
                    Instant base = current.isAfter(now) ? current : now;
                    Instant extended = base.plus(extension);
                    RelationTuple updated = existing.get().withExpiresAt(extended);
                    return StatusOr.ofValue(
                        Mutation.commit(
                            state.with(ns, graph.edit().put(updated).build()),
                            extended,
                            List.of(
                                AuditEvent.forTuple(
                                    AuditEventType.EXPIRATION_UPDATED, ctx, updated, now))));
                  }));
        });
  }

  /** Live edges expiring within {@code within} from now, soonest first. */
  public StatusOr<List<RelationTuple>> listExpiring(RequestContext ctx, Duration within) {
    return guarded(
        "listExpiring",
        () -> {
          Status invalid = Validators.namespace(ctx.namespace());
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          if (within == null || within.isNegative()) {
            return StatusOr.ofStatus(Status.invalidArgument("within must not be negative"));
          }
          Instant now = now();
          Instant horizon = now.plus(within);
          return StatusOr.ofValue(
              store.snapshot().namespace(ctx.namespace()).tuples()
                  .filter(t -> t.expiresAt() != null && t.isLive(now))
                  .filter(t -> !t.expiresAt().isAfter(horizon))
                  .sorted(
                      Comparator.comparing(RelationTuple::expiresAt)
                          .thenComparingLong(RelationTuple::id))
                  .collect(ImmutableList.toImmutableList()));
        });
  }

  /**
   * Physically deletes the namespace's expired edges. Reads already ignore them, so this only
   * reclaims space.
   *
   * @return the number of edges deleted
   */
  public StatusOr<Integer> cleanupExpired(RequestContext ctx) {
    return guarded(
        "cleanupExpired",
        () -> {
          Status invalid = tenantNamespace(ctx);
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          Instant now = now();
          StatusOr<Integer> result =
              removeWhere(
                  ctx,
                  AuditEventType.TUPLE_EXPIRED_CLEANUP,
                  NamespaceGraph::tuples,
                  t -> t.isExpired(now));
          if (result.isOk()) {
            Logger.info("Cleaned up {} expired edges in {}", result.getValue(), ctx.namespace());
          }
          return result;
        });
  }

  /** Counters for the context's namespace. */
  public StatusOr<NamespaceStats> stats(RequestContext ctx) {
    return guarded(
        "stats",
        () -> {
          Status invalid = Validators.namespace(ctx.namespace());
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          Instant now = now();
          NamespaceGraph graph = store.snapshot().namespace(ctx.namespace());
          long expired = 0;
          Set<EntityRef> subjects = new HashSet<>();
          Set<EntityRef> resources = new HashSet<>();
          for (RelationTuple tuple : graph.tupleList()) {
            if (tuple.isExpired(now)) {
              expired++;
              continue;
            }
            subjects.add(tuple.subject().entity());
            resources.add(tuple.resource());
          }
          return StatusOr.ofValue(
              new NamespaceStats(
                  ctx.namespace(),
                  graph.tupleCount(),
                  expired,
                  graph.hierarchy().size(),
                  subjects.size(),
                  resources.size()));
        });
  }

  // ---------------------------------------------------------------------------
  // Hierarchy store
  // ---------------------------------------------------------------------------

  /**
   * Adds the rule "{@code permission} implies {@code implies}" on {@code resourceType} to the
   * context's namespace, which may be {@code global} for platform callers.
   *
   * <p>The rule is refused if {@code permission} is reachable from {@code implies} over the
   * rules it would be combined with: global plus the tenant for a tenant rule, global plus each
   * tenant in turn for a global rule.
   *
   * @return the id of the new or existing rule
   */
  public StatusOr<Long> addHierarchy(
      RequestContext ctx, String resourceType, String permission, String implies) {
    return guarded(
        "addHierarchy",
        () -> {
          Status invalid =
              Validators.firstError(
                  hierarchyNamespace(ctx),
                  Validators.identifier("resource type", resourceType),
                  Validators.identifier("permission", permission),
                  Validators.identifier("implies", implies));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          String ns = ctx.namespace();
          if (permission.equals(implies)) {
            Logger.warn("Rejected self-implying rule {} on {} in {}", permission, resourceType, ns);
            return StatusOr.ofStatus(
                Status.selfImplication(
                    String.format("Hierarchy cycle detected: %s implies itself", permission)));
          }
          Instant now = now();
          StatusOr<Mutation<Long>> committed =
              store.mutate(
                  state -> {
                    NamespaceGraph graph = state.namespace(ns);
                    Optional<HierarchyRule> existing =
                        graph.hierarchy().find(resourceType, permission, implies);
                    if (existing.isPresent()) {
                      return StatusOr.ofValue(Mutation.unchanged(existing.get().id()));
                    }
                    Optional<List<String>> cycle =
                        findHierarchyCycle(state, ns, resourceType, permission, implies);
                    if (cycle.isPresent()) {
                      return StatusOr.ofStatus(
                          Status.cycleDetected(
                              String.format(
                                  "Hierarchy cycle detected: adding %s -> %s would create a cycle"
                                      + " (%s already reaches %s)",
                                  permission,
                                  implies,
                                  String.join(" -> ", cycle.get()),
                                  permission)));
                    }
                    HierarchyRule rule =
                        new HierarchyRule(
                            store.nextId(), ns, resourceType, permission, implies, now);
                    return StatusOr.ofValue(
                        Mutation.commit(
                            state.with(ns, graph.withHierarchy(graph.hierarchy().with(rule))),
                            rule.id(),
                            List.of(
                                AuditEvent.forRule(
                                    AuditEventType.HIERARCHY_ADDED, ctx, rule, now))));
                  });
          if (committed.isNotOk()) {
            Logger.warn(
                "Rule {} -> {} on {} in {} rejected: {}",
                permission,
                implies,
                resourceType,
                ns,
                committed.getStatus());
          } else if (committed.getValue().next() != null) {
            Logger.info("Added rule {} -> {} on {} in {}", permission, implies, resourceType, ns);
          }
          return publish(committed);
        });
  }

  private static Optional<List<String>> findHierarchyCycle(
      GraphState state, String ns, String resourceType, String permission, String implies) {
    HierarchyGraph global = state.globalHierarchy();
    if (!HierarchyRule.GLOBAL_NAMESPACE.equals(ns)) {
      return PermissionClosure.findPath(
          global, state.namespace(ns).hierarchy(), resourceType, implies, permission);
    }
    Optional<List<String>> alone =
        PermissionClosure.findPath(global, HierarchyGraph.EMPTY, resourceType, implies, permission);
    if (alone.isPresent()) {
      return alone;
    }
    for (String tenant : state.tenantNamespaces()) {
      Optional<List<String>> path =
          PermissionClosure.findPath(
              global, state.namespace(tenant).hierarchy(), resourceType, implies, permission);
      if (path.isPresent()) {
        return path;
      }
    }
    return Optional.empty();
  }

  /**
   * Removes one rule from the context's namespace.
   *
   * @return true if the rule existed
   */
  public StatusOr<Boolean> removeHierarchy(
      RequestContext ctx, String resourceType, String permission, String implies) {
    return guarded(
        "removeHierarchy",
        () -> {
          Status invalid =
              Validators.firstError(
                  hierarchyNamespace(ctx),
                  Validators.identifier("resource type", resourceType),
                  Validators.identifier("permission", permission),
                  Validators.identifier("implies", implies));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          StatusOr<Integer> removed =
              removeRules(
                  ctx,
                  rule ->
                      rule.resourceType().equals(resourceType)
                          && rule.permission().equals(permission)
                          && rule.implies().equals(implies));
          return removed.map(count -> count > 0);
        });
  }

  /**
   * Removes every rule for {@code resourceType} from the context's namespace.
   *
   * @return the number of rules removed
   */
  public StatusOr<Integer> clearHierarchy(RequestContext ctx, String resourceType) {
    return guarded(
        "clearHierarchy",
        () -> {
          Status invalid =
              Validators.firstError(
                  hierarchyNamespace(ctx), Validators.identifier("resource type", resourceType));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          StatusOr<Integer> removed =
              removeRules(ctx, rule -> rule.resourceType().equals(resourceType));
          if (removed.isOk()) {
            Logger.info(
                "Cleared {} rules on {} in {}", removed.getValue(), resourceType, ctx.namespace());
          }
          return removed;
        });
  }

  private StatusOr<Integer> removeRules(RequestContext ctx, Predicate<HierarchyRule> doomed) {
    String ns = ctx.namespace();
    Instant now = now();
    return publish(
        store.mutate(
            state -> {
              NamespaceGraph graph = state.namespace(ns);
              List<HierarchyRule> removed =
                  graph.hierarchy().rules().stream().filter(doomed).collect(Collectors.toList());
              if (removed.isEmpty()) {
                return StatusOr.ofValue(Mutation.unchanged(0));
              }
              List<AuditEvent> events =
                  removed.stream()
                      .map(r -> AuditEvent.forRule(AuditEventType.HIERARCHY_REMOVED, ctx, r, now))
                      .collect(Collectors.toList());
              return StatusOr.ofValue(
                  Mutation.commit(
                      state.with(ns, graph.withHierarchy(graph.hierarchy().without(doomed))),
                      removed.size(),
                      events));
            }));
  }

  /**
   * Rules visible to the context's namespace: global rules followed by the tenant's own.
   *
   * @param resourceType restricts the listing to one type, or null for all
   */
  public StatusOr<List<HierarchyRule>> listHierarchy(
      RequestContext ctx, @Nullable String resourceType) {
    return guarded(
        "listHierarchy",
        () -> {
          Status invalid =
              Validators.firstError(
                  Validators.namespace(ctx.namespace()),
                  resourceType == null
                      ? Status.ok()
                      : Validators.identifier("resource type", resourceType));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          GraphState state = store.snapshot();
          ImmutableList.Builder<HierarchyRule> visible = ImmutableList.builder();
          visible.addAll(rulesOf(state.globalHierarchy(), resourceType));
          if (!HierarchyRule.GLOBAL_NAMESPACE.equals(ctx.namespace())) {
            visible.addAll(rulesOf(state.namespace(ctx.namespace()).hierarchy(), resourceType));
          }
          return StatusOr.ofValue(visible.build());
        });
  }

  private static List<HierarchyRule> rulesOf(HierarchyGraph hierarchy, @Nullable String type) {
    return type == null ? hierarchy.rules() : hierarchy.rules(type);
  }

  // ---------------------------------------------------------------------------
  // Queries
  // ---------------------------------------------------------------------------

  /** Whether {@code subject} holds {@code permission} on {@code resource}. */
  public StatusOr<Boolean> check(
      RequestContext ctx, SubjectRef subject, String permission, EntityRef resource) {
    return guarded(
        "check",
        () -> {
          Status invalid = validateQuery(ctx, subject, List.of(permission), resource);
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          return StatusOr.ofValue(
              checkEngine.check(
                  store.snapshot(), ctx.namespace(), subject, permission, resource, now()));
        });
  }

  /** Whether {@code subject} holds at least one of {@code permissions}. */
  public StatusOr<Boolean> checkAny(
      RequestContext ctx, SubjectRef subject, List<String> permissions, EntityRef resource) {
    return guarded(
        "checkAny",
        () -> {
          Status invalid = validateQuery(ctx, subject, permissions, resource);
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          return StatusOr.ofValue(
              checkEngine.checkAny(
                  store.snapshot(), ctx.namespace(), subject, permissions, resource, now()));
        });
  }

  /** Whether {@code subject} holds every one of {@code permissions}; true for an empty list. */
  public StatusOr<Boolean> checkAll(
      RequestContext ctx, SubjectRef subject, List<String> permissions, EntityRef resource) {
    return guarded(
        "checkAll",
        () -> {
          Status invalid = validateQuery(ctx, subject, permissions, resource);
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          return StatusOr.ofValue(
              checkEngine.checkAll(
                  store.snapshot(), ctx.namespace(), subject, permissions, resource, now()));
        });
  }

  /** The ids among {@code resourceIds} on which {@code subject} holds {@code permission}. */
  public StatusOr<List<String>> filterAuthorized(
      RequestContext ctx,
      SubjectRef subject,
      String resourceType,
      String permission,
      List<String> resourceIds) {
    return guarded(
        "filterAuthorized",
        () -> {
          Status invalid =
              Validators.firstError(
                  Validators.namespace(ctx.namespace()),
                  Validators.subject(subject),
                  Validators.identifier("resource type", resourceType),
                  Validators.identifier("permission", permission),
                  Validators.ids("resource_ids", resourceIds));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          return StatusOr.ofValue(
              checkEngine.filterAuthorized(
                  store.snapshot(),
                  ctx.namespace(),
                  subject,
                  resourceType,
                  permission,
                  resourceIds,
                  now()));
        });
  }

  /** Principals of the configured user type holding {@code permission}, sorted by id. */
  public StatusOr<List<EntityRef>> listUsers(
      RequestContext ctx, EntityRef resource, String permission, @Nullable Integer limit) {
    return listSubjects(
        ctx, resource, permission, config.engine().userSubjectType(), limit, null);
  }

  /**
   * Subjects of {@code subjectType} holding {@code permission} on {@code resource}, sorted by id.
   *
   * @param cursor the last id of the previous page, or null for the first page
   */
  public StatusOr<List<EntityRef>> listSubjects(
      RequestContext ctx,
      EntityRef resource,
      String permission,
      String subjectType,
      @Nullable Integer limit,
      @Nullable String cursor) {
    return guarded(
        "listSubjects",
        () -> {
          Status invalid =
              Validators.firstError(
                  Validators.namespace(ctx.namespace()),
                  Validators.entity("resource", resource),
                  Validators.identifier("permission", permission),
                  Validators.identifier("subject type", subjectType));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          return StatusOr.ofValue(
              listEngine.listSubjects(
                  store.snapshot(),
                  ctx.namespace(),
                  resource,
                  permission,
                  subjectType,
                  config.engine().effectiveLimit(limit),
                  cursor,
                  now()));
        });
  }

  /**
   * Ids of resources of {@code resourceType} on which {@code subject} holds {@code permission},
   * sorted.
   *
   * @param cursor the last id of the previous page, or null for the first page
   */
  public StatusOr<List<String>> listResources(
      RequestContext ctx,
      EntityRef subject,
      String resourceType,
      String permission,
      @Nullable Integer limit,
      @Nullable String cursor) {
    return guarded(
        "listResources",
        () -> {
          Status invalid =
              Validators.firstError(
                  Validators.namespace(ctx.namespace()),
                  Validators.entity("subject", subject),
                  Validators.identifier("resource type", resourceType),
                  Validators.identifier("permission", permission));
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          return StatusOr.ofValue(
              listEngine.listResources(
                  store.snapshot(),
                  ctx.namespace(),
                  subject,
                  resourceType,
                  permission,
                  config.engine().effectiveLimit(limit),
                  cursor,
                  now()));
        });
  }

  /** Same answer as {@link #check}, plus the witness path when access is allowed. */
  public StatusOr<Explanation> explain(
      RequestContext ctx, SubjectRef subject, String permission, EntityRef resource) {
    return guarded(
        "explain",
        () -> {
          Status invalid = validateQuery(ctx, subject, List.of(permission), resource);
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          return StatusOr.ofValue(
              checkEngine.explain(
                  store.snapshot(), ctx.namespace(), subject, permission, resource, now()));
        });
  }

  /** Binds a {@link ResourcePermissionChecker} to this service. */
  public ResourcePermissionChecker permissionChecker(
      RequestContext ctx, SubjectRef subject, EntityRef resource) {
    return new ResourcePermissionChecker(this, ctx, subject, resource);
  }

  // ---------------------------------------------------------------------------
  // Diagnostics and persistence
  // ---------------------------------------------------------------------------

  /** Every membership and parent cycle currently stored in the context's namespace. */
  public StatusOr<List<CyclePath>> detectCycles(RequestContext ctx) {
    return guarded(
        "detectCycles",
        () -> {
          Status invalid = Validators.namespace(ctx.namespace());
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          List<CyclePath> cycles =
              cycleGuard.detectCycles(store.snapshot().namespace(ctx.namespace()));
          for (CyclePath cycle : cycles) {
            Logger.warn("Cycle in {}: {}", ctx.namespace(), cycle);
          }
          return StatusOr.ofValue(cycles);
        });
  }

  /** Writes the context's namespace to the database, replacing what was stored. */
  public StatusOr<SyncResult> exportNamespace(RequestContext ctx, Connection conn) {
    return guarded(
        "exportNamespace",
        () -> {
          Status invalid = hierarchyNamespace(ctx);
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          return new NamespaceSyncOperation(conn)
              .export(ctx.namespace(), store.snapshot().namespace(ctx.namespace()));
        });
  }

  /**
   * Replaces the context's namespace with the copy stored in the database. The loaded edges are
   * not cycle-checked on the way in; cycles found afterwards are logged.
   */
  public StatusOr<SyncResult> importNamespace(RequestContext ctx, Connection conn) {
    return guarded(
        "importNamespace",
        () -> {
          Status invalid = hierarchyNamespace(ctx);
          if (invalid.isError()) {
            return StatusOr.ofStatus(invalid);
          }
          String ns = ctx.namespace();
          StatusOr<NamespaceGraph> loaded = new NamespaceSyncOperation(conn).load(ns);
          if (loaded.isNotOk()) {
            return StatusOr.ofStatus(loaded.getStatus());
          }
          NamespaceGraph graph = loaded.getValue();
          store.replaceNamespace(ns, graph);
          Logger.info(
              "Imported namespace {} ({} tuples, {} rules) actor={} request={}",
              ns,
              graph.tupleCount(),
              graph.hierarchy().size(),
              ctx.actorId(),
              ctx.requestId());
          List<CyclePath> cycles = cycleGuard.detectCycles(graph);
          if (!cycles.isEmpty()) {
            Logger.warn("Imported namespace {} contains {} cycles: {}", ns, cycles.size(), cycles);
          }
          return StatusOr.ofValue(new SyncResult(ns, graph.tupleCount(), graph.hierarchy().size()));
        });
  }

  // ---------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------

  private Instant now() {
    return config.clock().instant();
  }

  /** Tuple writes need a valid namespace other than 'global'. */
  private static Status tenantNamespace(RequestContext ctx) {
    Status status = Validators.namespace(ctx.namespace());
    if (status.isError()) {
      return status;
    }
    if (HierarchyRule.GLOBAL_NAMESPACE.equals(ctx.namespace())) {
      return Status.invalidArgument("The global namespace holds hierarchy rules only");
    }
    return Status.ok();
  }

  /** Rule writes may target 'global', but only from a platform context. */
  private static Status hierarchyNamespace(RequestContext ctx) {
    Status status = Validators.namespace(ctx.namespace());
    if (status.isError()) {
      return status;
    }
    if (HierarchyRule.GLOBAL_NAMESPACE.equals(ctx.namespace()) && !ctx.platform()) {
      return Status.permissionDenied("Writing the global namespace requires a platform context");
    }
    return Status.ok();
  }

  private static Status validateQuery(
      RequestContext ctx, SubjectRef subject, Collection<String> permissions, EntityRef resource) {
    Status status =
        Validators.firstError(
            Validators.namespace(ctx.namespace()),
            Validators.subject(subject),
            Validators.entity("resource", resource));
    if (status.isError()) {
      return status;
    }
    if (permissions == null) {
      return Status.invalidArgument("permissions are required");
    }
    for (String permission : permissions) {
      status = Validators.identifier("permission", permission);
      if (status.isError()) {
        return status;
      }
    }
    return Status.ok();
  }

  /** Publishes a committed mutation's audit events and unwraps its value. */
  private <T> StatusOr<T> publish(StatusOr<Mutation<T>> committed) {
    List<AuditEvent> events = committed.isOk() ? committed.getValue().events() : List.of();
    for (AuditEvent event : events) {
      try {
        Status recorded = config.auditSink().record(event);
        if (recorded.isError()) {
          Logger.error("Audit sink rejected event {}: {}", event.eventId(), recorded);
        }
      } catch (RuntimeException e) {
        Logger.error(e, "Audit sink failed for event {}.", event.eventId());
      }
    }
    return committed.map(Mutation::value);
  }

  /** Maps unexpected exceptions to INTERNAL at the service boundary. */
  private static <T> StatusOr<T> guarded(String operation, Supplier<StatusOr<T>> body) {
    try {
      return body.get();
    } catch (RuntimeException e) {
      Logger.error(e, "Unexpected failure in {}.", operation);
      return StatusOr.ofException(e);
    }
  }
}
