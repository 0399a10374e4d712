package com.relgraph.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Tunables of the graph engine.
 *
 * @param maxGroupDepth Bound on upward membership chases and on the membership cycle walk
 * @param maxResourceDepth Bound on parent-chain walks
 * @param maxHierarchyDepth Bound on permission implication chains
 * @param defaultListLimit Page size used when a list call passes no limit
 * @param maxListLimit Upper clamp for list page sizes
 * @param userSubjectType The subject type {@code listUsers} collects and bulk grants accept
 * @param recipientVisibility Whether "shared with me" may read across namespaces
 * @param parentInheritance Which relations cascade down parent edges
 */
public record EngineConfig(
    int maxGroupDepth,
    int maxResourceDepth,
    int maxHierarchyDepth,
    int defaultListLimit,
    int maxListLimit,
    String userSubjectType,
    boolean recipientVisibility,
    ParentInheritancePolicy parentInheritance) {

  public static final int DEFAULT_MAX_DEPTH = 50;
  public static final int DEFAULT_LIST_LIMIT = 50;
  public static final int MAX_LIST_LIMIT = 1000;
  public static final String DEFAULT_USER_TYPE = "user";

  public EngineConfig {
    Preconditions.checkArgument(maxGroupDepth > 0, "maxGroupDepth must be positive");
    Preconditions.checkArgument(maxResourceDepth > 0, "maxResourceDepth must be positive");
    Preconditions.checkArgument(maxHierarchyDepth > 0, "maxHierarchyDepth must be positive");
    Preconditions.checkArgument(defaultListLimit > 0, "defaultListLimit must be positive");
    Preconditions.checkArgument(
        maxListLimit >= defaultListLimit, "maxListLimit must be at least defaultListLimit");
    Preconditions.checkNotNull(userSubjectType, "userSubjectType");
    Preconditions.checkNotNull(parentInheritance, "parentInheritance");
  }

  public static EngineConfig defaults() {
    return new EngineConfig(
        DEFAULT_MAX_DEPTH,
        DEFAULT_MAX_DEPTH,
        DEFAULT_MAX_DEPTH,
        DEFAULT_LIST_LIMIT,
        MAX_LIST_LIMIT,
        DEFAULT_USER_TYPE,
        false,
        ParentInheritancePolicy.cascadeAll());
  }

  /** Reads the {@code RELGRAPH_*} variables, falling back to the defaults. */
  public static EngineConfig fromEnvironment(Map<String, String> env) {
    EngineConfig config =
        new EngineConfig(
            intVar(env, "RELGRAPH_MAX_GROUP_DEPTH", DEFAULT_MAX_DEPTH),
            intVar(env, "RELGRAPH_MAX_RESOURCE_DEPTH", DEFAULT_MAX_DEPTH),
            intVar(env, "RELGRAPH_MAX_HIERARCHY_DEPTH", DEFAULT_MAX_DEPTH),
            intVar(env, "RELGRAPH_DEFAULT_LIST_LIMIT", DEFAULT_LIST_LIMIT),
            intVar(env, "RELGRAPH_MAX_LIST_LIMIT", MAX_LIST_LIMIT),
            MoreObjects.firstNonNull(
                Strings.emptyToNull(env.get("RELGRAPH_USER_TYPE")), DEFAULT_USER_TYPE),
            Boolean.parseBoolean(env.get("RELGRAPH_RECIPIENT_VISIBILITY")),
            ParentInheritancePolicy.parse(env.get("RELGRAPH_PARENT_INHERITANCE")));
    Logger.info("Configured engine: {}", config);
    return config;
  }

  /** Maps a caller-supplied page size onto {@code [1, maxListLimit]}. */
  public int effectiveLimit(Integer requested) {
    if (requested == null || requested <= 0) {
      return defaultListLimit;
    }
    return Math.min(requested, maxListLimit);
  }

  public EngineConfig withRecipientVisibility(boolean enabled) {
    return new EngineConfig(
        maxGroupDepth,
        maxResourceDepth,
        maxHierarchyDepth,
        defaultListLimit,
        maxListLimit,
        userSubjectType,
        enabled,
        parentInheritance);
  }

  public EngineConfig withParentInheritance(ParentInheritancePolicy policy) {
    return new EngineConfig(
        maxGroupDepth,
        maxResourceDepth,
        maxHierarchyDepth,
        defaultListLimit,
        maxListLimit,
        userSubjectType,
        recipientVisibility,
        policy);
  }

  public EngineConfig withDepths(int groupDepth, int resourceDepth, int hierarchyDepth) {
    return new EngineConfig(
        groupDepth,
        resourceDepth,
        hierarchyDepth,
        defaultListLimit,
        maxListLimit,
        userSubjectType,
        recipientVisibility,
        parentInheritance);
  }

  private static int intVar(Map<String, String> env, String name, int defaultValue) {
    String raw = Strings.emptyToNull(env.get(name));
    if (raw == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      Logger.warn("Ignoring non-numeric {}={}, using default {}", name, raw, defaultValue);
      return defaultValue;
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("maxGroupDepth", maxGroupDepth)
        .add("maxResourceDepth", maxResourceDepth)
        .add("maxHierarchyDepth", maxHierarchyDepth)
        .add("defaultListLimit", defaultListLimit)
        .add("maxListLimit", maxListLimit)
        .add("userSubjectType", userSubjectType)
        .add("recipientVisibility", recipientVisibility)
        .add("parentInheritance", parentInheritance)
        .toString();
  }
}
