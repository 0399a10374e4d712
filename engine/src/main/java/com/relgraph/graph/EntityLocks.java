package com.relgraph.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Striped;
import com.relgraph.model.EntityRef;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;

/**
 * Striped mutexes keyed by canonical entity identity, taken around structural writes.
 *
 * <p>Both endpoints of an edge are locked through {@link Striped#bulkGet}, which returns the
 * stripes in stripe-index order. Every writer therefore acquires in the same total order no
 * matter which endpoint is the parent.
 */
public final class EntityLocks {

  public static final int DEFAULT_STRIPES = 1024;
  private static final char SEPARATOR = '\u001F';

  private final Striped<Lock> stripes;

  public EntityLocks() {
    this(DEFAULT_STRIPES);
  }

  public EntityLocks(int stripeCount) {
    this.stripes = Striped.lock(stripeCount);
  }

  /** {@code namespace␟type␟id}. */
  public static String canonicalKey(String namespace, EntityRef entity) {
    return namespace + SEPARATOR + entity.type() + SEPARATOR + entity.id();
  }

  /** Locks held for one operation. Closing releases them in reverse order. */
  public static final class Held implements AutoCloseable {
    private final List<Lock> locks;

    private Held(List<Lock> locks) {
      this.locks = locks;
    }

    int count() {
      return locks.size();
    }

    @Override
    public void close() {
      for (int i = locks.size() - 1; i >= 0; i--) {
        locks.get(i).unlock();
      }
    }
  }

  /** Blocks until the stripes for both endpoints are held. */
  public Held acquire(String namespace, EntityRef first, EntityRef second) {
    Iterable<Lock> ordered =
        stripes.bulkGet(
            ImmutableList.of(canonicalKey(namespace, first), canonicalKey(namespace, second)));
    List<Lock> acquired = new ArrayList<>(2);
    try {
      for (Lock lock : ordered) {
        lock.lock();
        acquired.add(lock);
      }
    } catch (RuntimeException e) {
      new Held(acquired).close();
      throw e;
    }
    return new Held(acquired);
  }
}
