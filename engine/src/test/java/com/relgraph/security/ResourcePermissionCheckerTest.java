package com.relgraph.security;

import static org.junit.jupiter.api.Assertions.*;

import com.relgraph.AuthzServiceImpl;
import com.relgraph.context.RequestContext;
import com.relgraph.model.EntityRef;
import com.relgraph.model.SubjectRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ResourcePermissionCheckerTest {

  private AuthzServiceImpl service;
  private final RequestContext ctx = RequestContext.forTenant("acme");
  private final EntityRef repo = EntityRef.of("repo", "x");
  private final SubjectRef bob = SubjectRef.of("user", "bob");

  @BeforeEach
  void setUp() {
    service = new AuthzServiceImpl(AuthzServiceImpl.Config.defaults());
    service.addHierarchy(RequestContext.forTenant("global").asPlatform(), "repo", "write", "read");
    service.grant(ctx, repo, "write", bob, null);
  }

  @Test
  void testHasPermission() {
    PermissionChecker checker = service.permissionChecker(ctx, bob, repo);
    assertTrue(checker.hasPermission("write"));
    assertTrue(checker.hasPermission("read"));
    assertFalse(checker.hasPermission("admin"));
  }

  @Test
  void testAnyAndAll() {
    PermissionChecker checker = service.permissionChecker(ctx, bob, repo);
    assertTrue(checker.hasAnyPermission("admin", "read"));
    assertFalse(checker.hasAnyPermission("admin"));
    assertTrue(checker.hasAllPermissions("read", "write"));
    assertFalse(checker.hasAllPermissions("read", "admin"));
    assertTrue(checker.hasAllPermissions());
    assertFalse(checker.hasAnyPermission());
  }

  @Test
  void testFailedCheckCountsAsDenied() {
    PermissionChecker checker = service.permissionChecker(ctx, bob, repo);
    assertFalse(checker.hasPermission("Not Valid"));
    assertFalse(checker.hasAllPermissions("read", "Not Valid"));
  }

  @Test
  void testSeesLaterWrites() {
    PermissionChecker checker =
        service.permissionChecker(ctx, SubjectRef.of("user", "alice"), repo);
    assertFalse(checker.hasPermission("read"));
    service.grant(ctx, repo, "read", SubjectRef.of("user", "alice"), null);
    assertTrue(checker.hasPermission("read"));
  }
}
