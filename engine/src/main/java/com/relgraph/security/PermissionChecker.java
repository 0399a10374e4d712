package com.relgraph.security;

/**
 * Interface defining the contract for permission checking.
 *
 * <p>Implementers answer whether some fixed principal holds a named permission on some fixed
 * target. Besides the single check {@link #hasPermission}, implementations answer
 * any/all questions over several permissions, so they can batch the lookups.
 */
public interface PermissionChecker {
  /**
   * Checks if the permission is held.
   *
   * @param permission The permission to check
   * @return true if the permission is held, false otherwise
   */
  boolean hasPermission(String permission);

  /**
   * Checks if any of the specified permissions is held.
   *
   * @param permissions The permissions to check
   * @return true if at least one permission is held, false if none (or none given)
   */
  boolean hasAnyPermission(String... permissions);

  /**
   * Checks if all of the specified permissions are held.
   *
   * @param permissions The permissions to check
   * @return true if every permission is held, including when none are given
   */
  boolean hasAllPermissions(String... permissions);
}
