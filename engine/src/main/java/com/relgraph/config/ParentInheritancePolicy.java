package com.relgraph.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which relations cascade from a parent resource down to its children.
 *
 * <p>Child resource types without an entry inherit every relation. A type with an entry inherits
 * only the relations listed for it; an empty set disables inheritance for that type.
 */
public final class ParentInheritancePolicy {

  private static final ParentInheritancePolicy CASCADE_ALL =
      new ParentInheritancePolicy(ImmutableMap.of());

  private final ImmutableMap<String, ImmutableSet<String>> restrictions;

  private ParentInheritancePolicy(Map<String, ? extends Set<String>> restrictions) {
    ImmutableMap.Builder<String, ImmutableSet<String>> builder = ImmutableMap.builder();
    restrictions.forEach((type, relations) -> builder.put(type, ImmutableSet.copyOf(relations)));
    this.restrictions = builder.buildOrThrow();
  }

  public static ParentInheritancePolicy cascadeAll() {
    return CASCADE_ALL;
  }

  public static ParentInheritancePolicy of(Map<String, ? extends Set<String>> restrictions) {
    return restrictions.isEmpty() ? CASCADE_ALL : new ParentInheritancePolicy(restrictions);
  }

  /**
   * Parses {@code "doc=read|write;folder=read"}. An entry with nothing after {@code =} turns
   * inheritance off for that type.
   *
   * @throws IllegalArgumentException if an entry has no {@code =}
   */
  public static ParentInheritancePolicy parse(String spec) {
    if (spec == null || spec.isBlank()) {
      return CASCADE_ALL;
    }
    ImmutableMap.Builder<String, ImmutableSet<String>> parsed = ImmutableMap.builder();
    for (String entry : Splitter.on(';').trimResults().omitEmptyStrings().split(spec)) {
      List<String> parts = Splitter.on('=').trimResults().limit(2).splitToList(entry);
      if (parts.size() != 2 || parts.get(0).isEmpty()) {
        throw new IllegalArgumentException("Malformed parent inheritance entry: " + entry);
      }
      parsed.put(
          parts.get(0),
          ImmutableSet.copyOf(
              Splitter.on('|').trimResults().omitEmptyStrings().split(parts.get(1))));
    }
    return of(parsed.buildOrThrow());
  }

  /** Whether holding {@code relation} on a parent grants it on a child of {@code childType}. */
  public boolean cascades(String childType, String relation) {
    ImmutableSet<String> allowed = restrictions.get(childType);
    return allowed == null || allowed.contains(relation);
  }

  public boolean isCascadeAll() {
    return restrictions.isEmpty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("restrictions", restrictions).toString();
  }
}
