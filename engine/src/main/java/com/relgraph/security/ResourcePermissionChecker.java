package com.relgraph.security;

import com.relgraph.AuthzServiceImpl;
import com.relgraph.common.status.StatusOr;
import com.relgraph.context.RequestContext;
import com.relgraph.model.EntityRef;
import com.relgraph.model.SubjectRef;
import java.util.Arrays;
import org.tinylog.Logger;

/**
 * A {@link PermissionChecker} for one subject on one resource, backed by the graph engine.
 * Every call evaluates against the latest graph. A failed check (for example an invalid
 * permission name) counts as not held.
 */
public final class ResourcePermissionChecker implements PermissionChecker {

  private final AuthzServiceImpl service;
  private final RequestContext context;
  private final SubjectRef subject;
  private final EntityRef resource;

  public ResourcePermissionChecker(
      AuthzServiceImpl service, RequestContext context, SubjectRef subject, EntityRef resource) {
    this.service = service;
    this.context = context;
    this.subject = subject;
    this.resource = resource;
  }

  @Override
  public boolean hasPermission(String permission) {
    return held(service.check(context, subject, permission, resource), permission);
  }

  @Override
  public boolean hasAnyPermission(String... permissions) {
    return held(
        service.checkAny(context, subject, Arrays.asList(permissions), resource),
        String.join("|", permissions));
  }

  @Override
  public boolean hasAllPermissions(String... permissions) {
    return held(
        service.checkAll(context, subject, Arrays.asList(permissions), resource),
        String.join("&", permissions));
  }

  private boolean held(StatusOr<Boolean> result, String permission) {
    if (result.isNotOk()) {
      Logger.warn(
          "Permission check {} for {} on {} failed: {}",
          permission,
          subject,
          resource,
          result.getStatus());
      return false;
    }
    return result.getValue();
  }
}
