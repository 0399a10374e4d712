package com.relgraph.audit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.relgraph.AuthzServiceImpl;
import com.relgraph.MutableClock;
import com.relgraph.common.status.Status;
import com.relgraph.config.EngineConfig;
import com.relgraph.context.RequestContext;
import com.relgraph.model.EntityRef;
import com.relgraph.model.SubjectRef;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class AuditPublishingTest {

  @Mock private AuditSink sink;

  private AuthzServiceImpl service;
  private final RequestContext ctx = RequestContext.forTenant("acme").withActor("ops");

  @BeforeEach
  void setUp() {
    service =
        new AuthzServiceImpl(
            new AuthzServiceImpl.Config(
                EngineConfig.defaults(),
                sink,
                new MutableClock(Instant.parse("2025-03-01T12:00:00Z"))));
  }

  @Test
  void testOneEventPerCommittedTuple() {
    when(sink.record(any())).thenReturn(Status.ok());

    service.grantBulk(ctx, EntityRef.of("repo", "x"), "read", "user", List.of("a", "b"));

    ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
    verify(sink, times(2)).record(captor.capture());
    for (AuditEvent event : captor.getAllValues()) {
      assertEquals(AuditEventType.TUPLE_GRANTED, event.eventType());
      assertEquals("ops", event.actorId());
      assertEquals("repo", event.resourceType());
      assertEquals("x", event.resourceId());
      assertEquals(Instant.parse("2025-03-01T12:00:00Z"), event.eventTime());
    }
  }

  @Test
  void testRejectedWritesAreNotAudited() {
    service.grant(ctx, EntityRef.of("team", "a"), "member", SubjectRef.of("team", "a"), null);
    service.revoke(ctx, EntityRef.of("repo", "x"), "read", SubjectRef.of("user", "a"));
    verify(sink, never()).record(any());
  }

  @Test
  void testFailingSinkDoesNotUndoTheWrite() {
    when(sink.record(any())).thenThrow(new IllegalStateException("sink down"));

    assertTrue(
        service
            .grant(ctx, EntityRef.of("repo", "x"), "read", SubjectRef.of("user", "a"), null)
            .isOk());
    assertTrue(
        service
            .check(ctx, SubjectRef.of("user", "a"), "read", EntityRef.of("repo", "x"))
            .getValue());
  }

  @Test
  void testSinkErrorStatusIsTolerated() {
    when(sink.record(any())).thenReturn(Status.internal("disk full", null));

    assertTrue(
        service
            .grant(ctx, EntityRef.of("repo", "x"), "read", SubjectRef.of("user", "a"), null)
            .isOk());
    verify(sink).record(any());
  }
}
