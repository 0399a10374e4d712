package com.relgraph.graph;

import com.google.common.collect.ImmutableList;
import com.relgraph.audit.AuditEvent;
import com.relgraph.common.status.Status;
import com.relgraph.common.status.StatusOr;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Holds the current {@link GraphState} and serializes writers by compare-and-set.
 *
 * <p>A write reads the current snapshot, validates against it and proposes a successor. If
 * another writer committed in the meantime the proposal is discarded and the write is
 * re-validated against the newer snapshot. Readers never block.
 */
public final class GraphStore {

  public static final int DEFAULT_MAX_ATTEMPTS = 64;

  private final AtomicReference<GraphState> current = new AtomicReference<>(GraphState.empty());
  private final AtomicLong idSequence = new AtomicLong();
  private final int maxAttempts;

  public GraphStore() {
    this(DEFAULT_MAX_ATTEMPTS);
  }

  public GraphStore(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  /**
   * Outcome of one validated write attempt.
   *
   * @param next The proposed successor, or null when the write changes nothing
   * @param value What the operation returns to its caller
   * @param events Audit events to publish once {@code next} is committed
   */
  public record Mutation<T>(@Nullable GraphState next, T value, List<AuditEvent> events) {

    public Mutation {
      events = ImmutableList.copyOf(events);
    }

    public static <T> Mutation<T> commit(GraphState next, T value, List<AuditEvent> events) {
      return new Mutation<>(next, value, events);
    }

    public static <T> Mutation<T> unchanged(T value) {
      return new Mutation<>(null, value, List.of());
    }
  }

  public GraphState snapshot() {
    return current.get();
  }

  public long nextId() {
    return idSequence.incrementAndGet();
  }

  /**
   * Runs {@code attempt} against the latest snapshot until its successor commits.
   *
   * @return the committed mutation, the attempt's own error, or ABORTED when every attempt lost
   *     the race
   */
  @Nonnull
  public <T> StatusOr<Mutation<T>> mutate(Function<GraphState, StatusOr<Mutation<T>>> attempt) {
    for (int i = 0; i < maxAttempts; i++) {
      GraphState base = current.get();
      StatusOr<Mutation<T>> proposed = attempt.apply(base);
      if (proposed.isNotOk()) {
        return proposed;
      }
      Mutation<T> mutation = proposed.getValue();
      if (mutation.next() == null) {
        return proposed;
      }
      if (current.compareAndSet(base, mutation.next())) {
        return proposed;
      }
      Logger.debug("Graph version {} changed under writer, retrying ({})", base.version(), i + 1);
    }
    return StatusOr.ofStatus(
        Status.aborted("Write did not commit after " + maxAttempts + " attempts"));
  }

  /** Replaces one namespace wholesale. Used by import; performs no validation. */
  public void replaceNamespace(String namespace, NamespaceGraph graph) {
    current.updateAndGet(state -> state.with(namespace, graph));
    bumpIdsPast(graph);
  }

  private void bumpIdsPast(NamespaceGraph graph) {
    long maxTupleId = graph.tuples().mapToLong(t -> t.id()).max().orElse(0L);
    long maxRuleId = graph.hierarchy().rules().stream().mapToLong(r -> r.id()).max().orElse(0L);
    long max = Math.max(maxTupleId, maxRuleId);
    idSequence.accumulateAndGet(max, Math::max);
  }
}
