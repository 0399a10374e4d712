package com.relgraph.query;

import static com.relgraph.TestGraphs.T0;
import static com.relgraph.TestGraphs.entity;
import static com.relgraph.TestGraphs.subject;
import static com.relgraph.query.QueryFixtures.NS;
import static org.junit.jupiter.api.Assertions.*;

import com.relgraph.TestGraphs;
import com.relgraph.config.EngineConfig;
import com.relgraph.graph.GraphState;
import com.relgraph.model.EntityRef;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ListEngineTest {

  private final EngineConfig config = EngineConfig.defaults();
  private final ListEngine lists = new ListEngine(config);
  private final CheckEngine checks = new CheckEngine(config);
  private final GraphState state = QueryFixtures.acmeState();

  private List<String> subjects(String resource, String permission, int limit, String cursor) {
    List<String> ids = new ArrayList<>();
    for (EntityRef ref :
        lists.listSubjects(state, NS, entity(resource), permission, "user", limit, cursor, T0)) {
      ids.add(ref.id());
    }
    return ids;
  }

  @Test
  void testListSubjects() {
    assertEquals(List.of("alice", "bob"), subjects("repo:x", "read", 10, null));
    assertEquals(List.of("alice"), subjects("repo:x", "admin", 10, null));
    assertEquals(List.of("bob"), subjects("repo:y", "read", 10, null));
    assertEquals(List.of("carol"), subjects("doc:readme", "read", 10, null));
    assertTrue(subjects("repo:z", "read", 10, null).isEmpty());
    assertEquals(List.of("erin"), subjects("repo:w", "read", 10, null));
  }

  @Test
  void testListSubjectsPaging() {
    assertEquals(List.of("alice"), subjects("repo:x", "read", 1, null));
    assertEquals(List.of("bob"), subjects("repo:x", "read", 1, "alice"));
    assertTrue(subjects("repo:x", "read", 1, "bob").isEmpty());
  }

  @Test
  void testListSubjectsOfOtherTypes() {
    assertEquals(
        List.of(entity("team:eng")),
        lists.listSubjects(state, NS, entity("repo:x"), "read", "team", 10, null, T0));
  }

  @Test
  void testListResources() {
    assertEquals(
        List.of("x", "y"),
        lists.listResources(state, NS, entity("user:bob"), "repo", "read", 10, null, T0));
    assertEquals(
        List.of("y"),
        lists.listResources(state, NS, entity("user:bob"), "repo", "read", 10, "x", T0));
    assertEquals(
        List.of("x"),
        lists.listResources(state, NS, entity("user:bob"), "repo", "write", 10, null, T0));
    assertEquals(
        List.of("readme"),
        lists.listResources(state, NS, entity("user:carol"), "doc", "read", 10, null, T0));
    assertTrue(
        lists
            .listResources(state, NS, entity("user:dave"), "repo", "read", 10, null, T0)
            .isEmpty());
  }

  @Test
  void testListsRespectDepthBounds() {
    GraphState graph =
        TestGraphs.in(NS)
            .grant("team:g1", "member", "user:bob")
            .grant("team:g2", "member", "team:g1")
            .grant("team:g3", "member", "team:g2")
            .grant("repo:x", "read", "team:g3")
            .grant("repo:y", "read", "team:g1")
            .state();
    ListEngine shallow = new ListEngine(EngineConfig.defaults().withDepths(2, 2, 50));
    assertEquals(
        List.of("y"),
        shallow.listResources(graph, NS, entity("user:bob"), "repo", "read", 10, null, T0));
    assertTrue(
        shallow.listSubjects(graph, NS, entity("repo:x"), "read", "user", 10, null, T0).isEmpty());
    assertEquals(
        List.of("x", "y"),
        lists.listResources(graph, NS, entity("user:bob"), "repo", "read", 10, null, T0));
  }

  @Test
  void testListsAgreeWithCheck() {
    List<String> users = List.of("alice", "bob", "carol", "dave", "erin", "nobody");
    List<String> repos = List.of("x", "y", "z", "w");
    for (String permission : List.of("read", "write", "admin")) {
      for (String repo : repos) {
        List<String> expected = new ArrayList<>();
        for (String user : users) {
          if (checks.check(
              state, NS, subject("user:" + user), permission, entity("repo:" + repo), T0)) {
            expected.add(user);
          }
        }
        assertEquals(
            expected, subjects("repo:" + repo, permission, 100, null), permission + " " + repo);
      }
      for (String user : users) {
        List<String> expected = new ArrayList<>();
        for (String repo : List.of("w", "x", "y", "z")) {
          if (checks.check(
              state, NS, subject("user:" + user), permission, entity("repo:" + repo), T0)) {
            expected.add(repo);
          }
        }
        assertEquals(
            expected,
            lists.listResources(
                state, NS, entity("user:" + user), "repo", permission, 100, null, T0),
            permission + " " + user);
      }
    }
  }
}
