package com.relgraph;

import static com.relgraph.TestGraphs.T0;
import static com.relgraph.TestGraphs.entity;
import static com.relgraph.TestGraphs.subject;
import static org.junit.jupiter.api.Assertions.*;

import com.relgraph.audit.AuditEvent;
import com.relgraph.audit.AuditEventType;
import com.relgraph.audit.SegmentedAuditLog;
import com.relgraph.common.status.StatusCode;
import com.relgraph.common.status.StatusOr;
import com.relgraph.config.EngineConfig;
import com.relgraph.context.RequestContext;
import com.relgraph.model.CyclePath;
import com.relgraph.model.EntityRef;
import com.relgraph.model.Explanation;
import com.relgraph.model.HierarchyRule;
import com.relgraph.model.NamespaceStats;
import com.relgraph.model.RelationTuple;
import com.relgraph.model.SubjectRef;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class AuthzServiceImplTest {

  private MutableClock clock;
  private SegmentedAuditLog auditLog;
  private AuthzServiceImpl service;

  private final RequestContext acme =
      RequestContext.forTenant("acme").withActor("admin").withReason("setup");
  private final RequestContext platform = RequestContext.forTenant("global").asPlatform();

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    auditLog = new SegmentedAuditLog(clock);
    service =
        new AuthzServiceImpl(
            new AuthzServiceImpl.Config(EngineConfig.defaults(), auditLog, clock));
  }

  private long grant(RequestContext ctx, String resource, String relation, String subject) {
    StatusOr<Long> result = service.grant(ctx, entity(resource), relation, subject(subject), null);
    assertTrue(result.isOk(), () -> result.getStatus().toString());
    return result.getValue();
  }

  private boolean check(RequestContext ctx, String subject, String permission, String resource) {
    StatusOr<Boolean> result = service.check(ctx, subject(subject), permission, entity(resource));
    assertTrue(result.isOk(), () -> result.getStatus().toString());
    return result.getValue();
  }

  private List<AuditEventType> eventTypes() {
    return auditLog.events().stream().map(AuditEvent::eventType).collect(Collectors.toList());
  }

  @Test
  void testGrantIsIdempotent() {
    long first = grant(acme, "repo:x", "read", "user:bob");
    long second = grant(acme, "repo:x", "read", "user:bob");
    assertEquals(first, second);
    assertEquals(1, service.stats(acme).getValue().tupleCount());
    assertEquals(List.of(AuditEventType.TUPLE_GRANTED), eventTypes());
  }

  @Test
  void testEmptySubjectRelationSharesKey() {
    long plain = grant(acme, "repo:x", "read", "user:bob");
    StatusOr<Long> again =
        service.grant(
            acme, entity("repo:x"), "read", new SubjectRef("user", "bob", ""), null);
    assertEquals(plain, again.getValue());
  }

  @Test
  void testGrantValidation() {
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service
            .grant(acme, EntityRef.of("Repo", "x"), "read", subject("user:bob"), null)
            .getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service.grant(acme, entity("repo:x"), "read", subject("user: bob"), null).getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service.grant(acme, entity("repo:x"), "read", subject("user:bob"), T0).getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service
            .grant(
                RequestContext.forTenant("Acme"),
                entity("repo:x"),
                "read",
                subject("user:bob"),
                null)
            .getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service.grant(platform, entity("repo:x"), "read", subject("user:bob"), null).getCode());
    assertTrue(auditLog.events().isEmpty());
  }

  @Test
  void testSelfEdgesRejected() {
    StatusOr<Long> member =
        service.grant(acme, entity("team:a"), "member", subject("team:a"), null);
    assertEquals(StatusCode.CYCLE_DETECTED, member.getCode());
    assertEquals("A group cannot be a member of itself: team:a", member.getStatus().getMessage());

    StatusOr<Long> parent = service.grant(acme, entity("doc:a"), "parent", subject("doc:a"), null);
    assertEquals(StatusCode.CYCLE_DETECTED, parent.getCode());
    assertEquals("A resource cannot be its own parent: doc:a", parent.getStatus().getMessage());
  }

  @Test
  void testMembershipCycleRejected() {
    grant(acme, "team:a", "member", "team:b");
    grant(acme, "team:b", "member", "team:c");
    StatusOr<Long> closing =
        service.grant(acme, entity("team:c"), "member", subject("team:a"), null);
    assertEquals(StatusCode.CYCLE_DETECTED, closing.getCode());
    assertEquals(
        "Adding team:a as a member of team:c would create a cycle",
        closing.getStatus().getMessage());
    assertEquals(2, service.stats(acme).getValue().tupleCount());
    assertTrue(service.detectCycles(acme).getValue().isEmpty());
  }

  @Test
  void testParentCycleRejected() {
    grant(acme, "doc:a", "parent", "folder:b");
    StatusOr<Long> closing =
        service.grant(acme, entity("folder:b"), "parent", subject("doc:a"), null);
    assertEquals(StatusCode.CYCLE_DETECTED, closing.getCode());
    assertEquals(
        "Setting doc:a as the parent of folder:b would create a cycle",
        closing.getStatus().getMessage());
  }

  @Test
  void testConcurrentReciprocalMembership() throws Exception {
    for (int round = 0; round < 25; round++) {
      RequestContext ctx = RequestContext.forTenant("race" + round);
      CountDownLatch start = new CountDownLatch(1);
      ExecutorService executor = Executors.newFixedThreadPool(2);
      try {
        Callable<StatusOr<Long>> forward =
            () -> {
              start.await();
              return service.grant(ctx, entity("team:a"), "member", subject("team:b"), null);
            };
        Callable<StatusOr<Long>> backward =
            () -> {
              start.await();
              return service.grant(ctx, entity("team:b"), "member", subject("team:a"), null);
            };
        Future<StatusOr<Long>> first = executor.submit(forward);
        Future<StatusOr<Long>> second = executor.submit(backward);
        start.countDown();
        StatusOr<Long> a = first.get(30, TimeUnit.SECONDS);
        StatusOr<Long> b = second.get(30, TimeUnit.SECONDS);

        assertTrue(a.isOk() ^ b.isOk(), "exactly one reciprocal grant may win");
        StatusOr<Long> loser = a.isOk() ? b : a;
        assertEquals(StatusCode.CYCLE_DETECTED, loser.getCode());
        assertEquals(1, service.stats(ctx).getValue().tupleCount());
        assertTrue(service.detectCycles(ctx).getValue().isEmpty());
      } finally {
        executor.shutdownNow();
      }
    }
  }

  @Test
  void testGroupPropagation() {
    grant(acme, "team:eng", "member", "user:bob");
    grant(acme, "repo:x", "read", "team:eng#member");
    assertTrue(check(acme, "user:bob", "read", "repo:x"));
    assertFalse(check(acme, "user:alice", "read", "repo:x"));

    grant(acme, "team:eng", "member", "team:frontend");
    grant(acme, "team:frontend", "member", "user:alice");
    // team:eng#member resolves member on team:eng, which nested groups satisfy.
    assertTrue(check(acme, "user:alice", "read", "repo:x"));

    service.revoke(acme, entity("team:eng"), "member", subject("team:frontend"));
    assertFalse(check(acme, "user:alice", "read", "repo:x"));
  }

  @Test
  void testHierarchyTransitivity() {
    assertTrue(service.addHierarchy(platform, "repo", "admin", "write").isOk());
    assertTrue(service.addHierarchy(platform, "repo", "write", "read").isOk());
    grant(acme, "repo:x", "admin", "user:alice");
    assertTrue(check(acme, "user:alice", "read", "repo:x"));
    assertFalse(check(acme, "user:alice", "read", "doc:x"));

    service.removeHierarchy(platform, "repo", "write", "read");
    assertFalse(check(acme, "user:alice", "read", "repo:x"));
    assertTrue(check(acme, "user:alice", "write", "repo:x"));
  }

  @Test
  void testHierarchyCycleRejected() {
    service.addHierarchy(acme, "repo", "admin", "write");
    service.addHierarchy(acme, "repo", "write", "read");
    StatusOr<Long> closing = service.addHierarchy(acme, "repo", "read", "admin");
    assertEquals(StatusCode.CYCLE_DETECTED, closing.getCode());
    assertTrue(
        closing
            .getStatus()
            .getMessage()
            .startsWith("Hierarchy cycle detected: adding read -> admin"),
        closing.getStatus().getMessage());
    assertEquals(2, service.listHierarchy(acme, "repo").getValue().size());

    StatusOr<Long> self = service.addHierarchy(acme, "repo", "read", "read");
    assertEquals(StatusCode.SELF_IMPLICATION, self.getCode());
    assertEquals("Hierarchy cycle detected: read implies itself", self.getStatus().getMessage());
  }

  @Test
  void testHierarchyCycleAcrossGlobalAndTenant() {
    service.addHierarchy(platform, "repo", "admin", "write");
    service.addHierarchy(acme, "repo", "write", "read");

    // Tenant rule closing a loop through a global rule.
    assertEquals(
        StatusCode.CYCLE_DETECTED, service.addHierarchy(acme, "repo", "read", "admin").getCode());
    // Global rule closing a loop through a tenant rule.
    assertEquals(
        StatusCode.CYCLE_DETECTED,
        service.addHierarchy(platform, "repo", "read", "admin").getCode());
    // Another tenant is unaffected by acme's rules.
    RequestContext other = RequestContext.forTenant("other");
    assertTrue(service.addHierarchy(other, "repo", "read", "admin").isOk());
  }

  @Test
  void testGlobalRulesRequirePlatform() {
    StatusOr<Long> denied =
        service.addHierarchy(RequestContext.forTenant("global"), "repo", "a", "b");
    assertEquals(StatusCode.PERMISSION_DENIED, denied.getCode());
  }

  @Test
  void testHierarchyListingAndClearing() {
    service.addHierarchy(platform, "repo", "admin", "write");
    service.addHierarchy(acme, "repo", "maintain", "write");
    service.addHierarchy(acme, "doc", "owner", "read");
    long existing = service.addHierarchy(acme, "doc", "owner", "read").getValue();

    List<HierarchyRule> visible = service.listHierarchy(acme, null).getValue();
    assertEquals(3, visible.size());
    assertTrue(visible.get(0).isGlobal());
    assertEquals(existing, service.listHierarchy(acme, "doc").getValue().get(0).id());

    assertEquals(1, service.clearHierarchy(acme, "repo").getValue());
    assertEquals(2, service.listHierarchy(acme, null).getValue().size());
    assertFalse(service.removeHierarchy(acme, "repo", "maintain", "write").getValue());
  }

  @Test
  void testExpiry() {
    Instant expiresAt = T0.plus(Duration.ofHours(1));
    service.grant(acme, entity("repo:x"), "read", subject("user:bob"), expiresAt);
    assertTrue(check(acme, "user:bob", "read", "repo:x"));
    assertEquals(1, service.listExpiring(acme, Duration.ofHours(2)).getValue().size());
    assertTrue(service.listExpiring(acme, Duration.ofMinutes(30)).getValue().isEmpty());

    clock.advance(Duration.ofHours(1));
    assertFalse(check(acme, "user:bob", "read", "repo:x"));
    assertTrue(service.listSubjectGrants(acme, entity("user:bob"), null).getValue().isEmpty());
    NamespaceStats stats = service.stats(acme).getValue();
    assertEquals(1, stats.tupleCount());
    assertEquals(1, stats.expiredTupleCount());

    // An expired edge is extended from now.
    Instant extended =
        service
            .extendExpiration(
                acme, entity("repo:x"), "read", subject("user:bob"), Duration.ofHours(2))
            .getValue();
    assertEquals(clock.instant().plus(Duration.ofHours(2)), extended);
    assertTrue(check(acme, "user:bob", "read", "repo:x"));

    assertTrue(
        service.clearExpiration(acme, entity("repo:x"), "read", subject("user:bob")).getValue());
    clock.advance(Duration.ofDays(365));
    assertTrue(check(acme, "user:bob", "read", "repo:x"));
    assertEquals(
        StatusCode.FAILED_PRECONDITION,
        service
            .extendExpiration(
                acme, entity("repo:x"), "read", subject("user:bob"), Duration.ofHours(1))
            .getCode());
  }

  @Test
  void testExpirationEdgeCases() {
    assertFalse(
        service
            .setExpiration(acme, entity("repo:x"), "read", subject("user:bob"), T0.plusSeconds(60))
            .getValue());
    assertEquals(
        StatusCode.NOT_FOUND,
        service
            .extendExpiration(
                acme, entity("repo:x"), "read", subject("user:bob"), Duration.ofHours(1))
            .getCode());
    grant(acme, "repo:x", "read", "user:bob");
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service.setExpiration(acme, entity("repo:x"), "read", subject("user:bob"), T0).getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service
            .extendExpiration(acme, entity("repo:x"), "read", subject("user:bob"), Duration.ZERO)
            .getCode());
  }

  @Test
  void testRegrantUpdatesExpiry() {
    service.grant(acme, entity("repo:x"), "read", subject("user:bob"), T0.plusSeconds(60));
    service.grant(acme, entity("repo:x"), "read", subject("user:bob"), null);
    clock.advance(Duration.ofHours(1));
    assertTrue(check(acme, "user:bob", "read", "repo:x"));
    assertEquals(
        List.of(AuditEventType.TUPLE_GRANTED, AuditEventType.EXPIRATION_UPDATED), eventTypes());
  }

  @Test
  void testCleanupExpired() {
    service.grant(acme, entity("repo:x"), "read", subject("user:bob"), T0.plusSeconds(60));
    service.grant(acme, entity("repo:y"), "read", subject("user:bob"), T0.plusSeconds(600));
    grant(acme, "repo:z", "read", "user:bob");
    clock.advance(Duration.ofSeconds(60));
    assertEquals(1, service.cleanupExpired(acme).getValue());
    assertEquals(2, service.stats(acme).getValue().tupleCount());
    assertEquals(0, service.cleanupExpired(acme).getValue());
    assertTrue(eventTypes().contains(AuditEventType.TUPLE_EXPIRED_CLEANUP));
  }

  @Test
  void testScopedRevoke() {
    grant(acme, "repo:x", "read", "user:bob");
    grant(acme, "repo:y", "write", "user:bob");
    grant(acme, "doc:d", "read", "user:bob");
    grant(acme, "repo:x", "read", "user:alice");
    grant(acme, "repo:x", "write", "user:alice");

    assertEquals(2, service.revokeSubjectGrants(acme, entity("user:bob"), "repo").getValue());
    assertEquals(
        List.of("doc:d"),
        service.listSubjectGrants(acme, entity("user:bob"), null).getValue().stream()
            .map(t -> t.resource().toString())
            .collect(Collectors.toList()));

    assertEquals(1, service.revokeResourceGrants(acme, entity("repo:x"), "write").getValue());
    assertTrue(check(acme, "user:alice", "read", "repo:x"));
    assertEquals(1, service.revokeResourceGrants(acme, entity("repo:x"), null).getValue());
    assertFalse(check(acme, "user:alice", "read", "repo:x"));

    assertTrue(service.revoke(acme, entity("doc:d"), "read", subject("user:bob")).getValue());
    assertFalse(service.revoke(acme, entity("doc:d"), "read", subject("user:bob")).getValue());
  }

  @Test
  void testTenantIsolation() {
    grant(acme, "repo:x", "read", "user:bob");
    RequestContext other = RequestContext.forTenant("other");
    assertFalse(check(other, "user:bob", "read", "repo:x"));
    assertEquals(0, service.revokeSubjectGrants(other, entity("user:bob"), null).getValue());
    assertTrue(check(acme, "user:bob", "read", "repo:x"));
  }

  @Test
  void testSharedWithMe() {
    grant(acme, "repo:x", "read", "user:bob");
    grant(RequestContext.forTenant("other"), "doc:d", "write", "user:bob");
    RequestContext viewer = acme.withViewer(entity("user:bob"));

    assertEquals(StatusCode.PERMISSION_DENIED, service.listSharedWithMe(viewer).getCode());

    AuthzServiceImpl open =
        new AuthzServiceImpl(
            new AuthzServiceImpl.Config(
                EngineConfig.defaults().withRecipientVisibility(true), auditLog, clock));
    open.grant(acme, entity("repo:x"), "read", subject("user:bob"), null);
    open.grant(
        RequestContext.forTenant("other"), entity("doc:d"), "write", subject("user:bob"), null);
    List<RelationTuple> shared = open.listSharedWithMe(viewer).getValue();
    assertEquals(
        List.of("acme", "other"),
        shared.stream().map(RelationTuple::namespace).collect(Collectors.toList()));
    assertEquals(StatusCode.INVALID_ARGUMENT, open.listSharedWithMe(acme).getCode());
  }

  @Test
  void testGrantBulk() {
    assertEquals(
        3,
        service
            .grantBulk(acme, entity("repo:x"), "read", "user", List.of("a", "b", "c", "a"))
            .getValue());
    assertEquals(
        1, service.grantBulk(acme, entity("repo:x"), "read", "user", List.of("a", "d")).getValue());
    assertEquals(4, service.listUsers(acme, entity("repo:x"), "read", null).getValue().size());

    StatusOr<Integer> badId =
        service.grantBulk(acme, entity("repo:x"), "read", "user", List.of("e", " f"));
    assertEquals(StatusCode.INVALID_ARGUMENT, badId.getCode());
    assertTrue(badId.getStatus().getMessage().contains("index 1"));
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service.grantBulk(acme, entity("doc:x"), "parent", "folder", List.of("f")).getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service.grantBulk(acme, entity("team:x"), "member", "team", List.of("y")).getCode());
    assertEquals(4, service.stats(acme).getValue().tupleCount());
  }

  @Test
  void testListUsersAndResources() {
    service.addHierarchy(platform, "repo", "write", "read");
    grant(acme, "team:eng", "member", "user:bob");
    grant(acme, "team:eng", "member", "user:carol");
    grant(acme, "repo:x", "write", "team:eng#member");
    grant(acme, "repo:x", "read", "user:alice");
    grant(acme, "repo:y", "read", "user:bob");

    assertEquals(
        List.of(entity("user:alice"), entity("user:bob"), entity("user:carol")),
        service.listUsers(acme, entity("repo:x"), "read", null).getValue());
    assertEquals(
        List.of(entity("user:bob"), entity("user:carol")),
        service.listUsers(acme, entity("repo:x"), "write", null).getValue());
    assertEquals(
        List.of(entity("user:alice")),
        service.listUsers(acme, entity("repo:x"), "read", 1).getValue());
    assertEquals(
        List.of(entity("user:carol")),
        service.listSubjects(acme, entity("repo:x"), "read", "user", 5, "bob").getValue());
    assertEquals(
        List.of("x", "y"),
        service.listResources(acme, entity("user:bob"), "repo", "read", null, null).getValue());
    assertEquals(
        List.of("x"),
        service.listResources(acme, entity("user:bob"), "repo", "write", null, null).getValue());
  }

  @Test
  void testExplainMatchesCheck() {
    service.addHierarchy(platform, "repo", "write", "read");
    grant(acme, "team:eng", "member", "user:bob");
    grant(acme, "repo:x", "write", "team:eng");

    Explanation allowed =
        service.explain(acme, subject("user:bob"), "read", entity("repo:x")).getValue();
    assertTrue(allowed.allowed());
    assertEquals(
        "HIERARCHY: user:bob has read (via write -> read) on repo:x\n"
            + "GROUP: user:bob is member of team:eng (via user:bob -> team:eng)"
            + " which has write on repo:x",
        allowed.text());

    Explanation denied =
        service.explain(acme, subject("user:alice"), "read", entity("repo:x")).getValue();
    assertFalse(denied.allowed());
    assertEquals(check(acme, "user:alice", "read", "repo:x"), denied.allowed());
  }

  @Test
  void testQueriesValidateInput() {
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service.check(acme, subject("user:bob"), "Read", entity("repo:x")).getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service
            .checkAny(acme, subject("user:bob"), List.of("read", "bad perm"), entity("repo:x"))
            .getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service
            .filterAuthorized(acme, subject("user:bob"), "repo", "read", List.of("x", ""))
            .getCode());
    assertTrue(service.checkAll(acme, subject("user:bob"), List.of(), entity("repo:x")).getValue());
  }

  @Test
  void testAuditTrail() {
    grant(acme, "repo:x", "read", "user:bob");
    service.setExpiration(acme, entity("repo:x"), "read", subject("user:bob"), T0.plusSeconds(60));
    service.revoke(acme, entity("repo:x"), "read", subject("user:bob"));
    service.addHierarchy(platform, "repo", "write", "read");
    service.removeHierarchy(platform, "repo", "write", "read");
    // Rejected and no-op writes leave no trace.
    service.grant(acme, entity("team:a"), "member", subject("team:a"), null);
    service.revoke(acme, entity("repo:x"), "read", subject("user:bob"));

    assertEquals(
        List.of(
            AuditEventType.TUPLE_GRANTED,
            AuditEventType.EXPIRATION_UPDATED,
            AuditEventType.TUPLE_REVOKED,
            AuditEventType.HIERARCHY_ADDED,
            AuditEventType.HIERARCHY_REMOVED),
        eventTypes());
    AuditEvent grantEvent = auditLog.events().get(0);
    assertEquals("admin", grantEvent.actorId());
    assertEquals("setup", grantEvent.reason());
    assertEquals(acme.requestId(), grantEvent.requestId());
    assertEquals("acme", grantEvent.namespace());
    assertEquals(List.of("audit_events_y2025m01"), auditLog.segmentNames());
  }

  @Test
  void testDetectCyclesEmptyNamespace() {
    StatusOr<List<CyclePath>> cycles = service.detectCycles(RequestContext.forTenant("empty"));
    assertTrue(cycles.isOk());
    assertTrue(cycles.getValue().isEmpty());
  }
}
