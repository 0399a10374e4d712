package com.relgraph.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of explain: whether access is allowed and, if so, the first chain of edges that
 * proves it.
 *
 * @param allowed Same answer check gives for the same query
 * @param path Witness hops, outermost first; empty when denied
 * @param text One line per hop, or a single {@code NO ACCESS} line when denied
 */
public record Explanation(boolean allowed, List<PathStep> path, String text) {

  public Explanation {
    path = ImmutableList.copyOf(path);
  }

  public static Explanation allowed(List<PathStep> path) {
    return new Explanation(
        true, path, path.stream().map(PathStep::description).collect(Collectors.joining("\n")));
  }

  public static Explanation denied(SubjectRef subject, String permission, EntityRef resource) {
    return new Explanation(
        false,
        List.of(),
        String.format("NO ACCESS: %s does not have %s on %s", subject, permission, resource));
  }
}
