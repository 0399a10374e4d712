package com.relgraph.db;

import static org.junit.jupiter.api.Assertions.*;

import com.relgraph.audit.AuditEvent;
import com.relgraph.audit.AuditEventType;
import com.relgraph.audit.JdbcAuditSink;
import com.relgraph.common.status.Status;
import com.relgraph.common.status.StatusOr;
import com.relgraph.config.DatabaseConfig;
import com.relgraph.context.RequestContext;
import com.relgraph.db.util.PostgresTestHelper;
import com.relgraph.model.EntityRef;
import com.relgraph.model.HierarchyRule;
import com.relgraph.model.RelationTuple;
import com.relgraph.model.SubjectRef;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Tests for the tuple, hierarchy rule and audit event DAOs. */
@Testcontainers(disabledWithoutDocker = true)
public class TuplesTest {

  private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

  private static PostgresTestHelper.PostgresContext postgres;
  private static Connection connection;

  @BeforeAll
  static void setUp() throws SQLException {
    postgres = PostgresTestHelper.setupPostgres("relgraph_tuples_test", TuplesTest.class);
    connection = postgres.getConnection();
  }

  @AfterAll
  static void tearDown() {
    if (postgres != null) {
      postgres.close();
    }
  }

  @BeforeEach
  void clearDatabase() throws SQLException {
    try (var stmt = connection.createStatement()) {
      stmt.execute("DELETE FROM relation_tuple");
      stmt.execute("DELETE FROM hierarchy_rule");
      stmt.execute("DELETE FROM audit_event");
    }
  }

  private static RelationTuple tuple(
      long id, String ns, String relation, SubjectRef subject, Instant expiresAt) {
    return new RelationTuple(id, ns, EntityRef.of("repo", "x"), relation, subject, T0, expiresAt);
  }

  private static List<String> storedEventIds(String namespace) {
    List<String> ids = new ArrayList<>();
    try (var stmt =
        connection.prepareStatement(
            "SELECT event_id FROM audit_event WHERE namespace = ? ORDER BY event_time")) {
      stmt.setString(1, namespace);
      try (var rs = stmt.executeQuery()) {
        while (rs.next()) {
          ids.add(rs.getString("event_id"));
        }
      }
    } catch (SQLException e) {
      fail("Could not read audit events: " + e.getMessage());
    }
    return ids;
  }

  @Test
  void testSaveAndLoad() {
    RelationTuple plain = tuple(1, "acme", "read", SubjectRef.of("user", "bob"), null);
    RelationTuple userset =
        tuple(2, "acme", "read", SubjectRef.userset("team", "eng", "member"), T0.plusSeconds(60));
    RelationTuple elsewhere = tuple(3, "other", "read", SubjectRef.of("user", "bob"), null);

    StatusOr<Integer> saved = Tuples.saveAll(connection, List.of(plain, userset, elsewhere));
    assertTrue(saved.isOk());
    assertEquals(3, saved.getValue());

    StatusOr<List<RelationTuple>> loaded = Tuples.loadNamespace(connection, "acme");
    assertTrue(loaded.isOk());
    assertEquals(List.of(plain, userset), loaded.getValue());
    assertNull(loaded.getValue().get(0).subject().relation());
    assertEquals(1, Tuples.loadNamespace(connection, "other").getValue().size());
  }

  @Test
  void testSaveUpsertsExpiry() {
    Tuples.saveAll(
        connection, List.of(tuple(1, "acme", "read", SubjectRef.of("user", "bob"), null)));
    // Same key under a different id only updates the expiry.
    Tuples.saveAll(
        connection,
        List.of(tuple(7, "acme", "read", SubjectRef.of("user", "bob"), T0.plusSeconds(30))));

    List<RelationTuple> loaded = Tuples.loadNamespace(connection, "acme").getValue();
    assertEquals(1, loaded.size());
    assertEquals(1L, loaded.get(0).id());
    assertEquals(T0.plusSeconds(30), loaded.get(0).expiresAt());
  }

  @Test
  void testDeleteNamespace() {
    Tuples.saveAll(
        connection,
        List.of(
            tuple(1, "acme", "read", SubjectRef.of("user", "a"), T0),
            tuple(2, "acme", "read", SubjectRef.of("user", "b"), null),
            tuple(3, "other", "read", SubjectRef.of("user", "c"), null)));

    assertEquals(2, Tuples.deleteNamespace(connection, "acme").getValue());
    assertTrue(Tuples.loadNamespace(connection, "acme").getValue().isEmpty());
    assertEquals(1, Tuples.loadNamespace(connection, "other").getValue().size());
  }

  @Test
  void testGlobalNamespaceRejectsTuples() {
    StatusOr<Integer> saved =
        Tuples.saveAll(
            connection, List.of(tuple(1, "global", "read", SubjectRef.of("user", "a"), null)));
    assertTrue(saved.isNotOk());
  }

  @Test
  void testHierarchyRules() {
    HierarchyRule write = new HierarchyRule(1, "global", "repo", "write", "read", T0);
    HierarchyRule admin = new HierarchyRule(2, "global", "repo", "admin", "write", T0);
    HierarchyRule tenant = new HierarchyRule(3, "acme", "repo", "maintain", "write", T0);

    assertEquals(3, HierarchyRules.saveAll(connection, List.of(write, admin, tenant)).getValue());
    assertEquals(0, HierarchyRules.saveAll(connection, List.of(write)).getValue());
    assertEquals(
        List.of(write, admin), HierarchyRules.loadNamespace(connection, "global").getValue());
    assertEquals(1, HierarchyRules.deleteNamespace(connection, "acme").getValue());
    assertTrue(HierarchyRules.loadNamespace(connection, "acme").getValue().isEmpty());
  }

  @Test
  void testAuditEvents() {
    RequestContext ctx = RequestContext.forTenant("acme").withActor("ops").withReason("ticket-1");
    RelationTuple granted =
        tuple(1, "acme", "read", SubjectRef.userset("team", "eng", "member"), T0.plusSeconds(60));
    AuditEvent first = AuditEvent.forTuple(AuditEventType.TUPLE_GRANTED, ctx, granted, T0);
    AuditEvent second =
        AuditEvent.forTuple(AuditEventType.TUPLE_REVOKED, ctx, granted, T0.plusSeconds(5));

    assertEquals(1, AuditEvents.insert(connection, first).getValue());
    assertEquals(1, AuditEvents.insert(connection, second).getValue());

    assertEquals(
        List.of(first.eventId().toString(), second.eventId().toString()),
        storedEventIds("acme"));
    assertTrue(storedEventIds("other").isEmpty());
    // Same event id twice violates the primary key.
    assertTrue(AuditEvents.insert(connection, first).isNotOk());
  }

  @Test
  void testJdbcAuditSink() {
    PostgresTestHelper.PostgresContext ctx = postgres;
    DatabaseConfig config =
        new DatabaseConfig(
            ctx.getContainer().getJdbcUrl(),
            ctx.getContainer().getUsername(),
            ctx.getContainer().getPassword());
    try (HikariDataSource dataSource = config.toDataSource()) {
      JdbcAuditSink sink = new JdbcAuditSink(dataSource);
      HierarchyRule rule = new HierarchyRule(4, "global", "repo", "write", "read", T0);
      AuditEvent event =
          AuditEvent.forRule(
              AuditEventType.HIERARCHY_ADDED,
              RequestContext.forTenant("global").asPlatform(),
              rule,
              T0);

      Status recorded = sink.record(event);
      assertTrue(recorded.isOk());
      assertEquals(List.of(event.eventId().toString()), storedEventIds("global"));
      // Same event id twice violates the primary key.
      assertTrue(sink.record(event).isError());
    }
    assertFalse(config.toSecureString().contains(ctx.getContainer().getPassword()));
  }
}
