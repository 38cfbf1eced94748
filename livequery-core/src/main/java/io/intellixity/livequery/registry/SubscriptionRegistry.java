package io.intellixity.livequery.registry;

import io.intellixity.livequery.change.Change;
import io.intellixity.livequery.query.Query;

import java.util.List;

/**
 * Active queries keyed by (name, connection id).
 * <p>
 * Implementations must be safe for concurrent use by registration calls and the matching pipeline
 * without external locking.
 */
public interface SubscriptionRegistry {

  /**
   * Registers the query unless one with the same key is already present.
   *
   * @return true if the query was added, false if the key was taken (the registry is unchanged)
   */
  boolean add(Query query);

  /** Replaces (or inserts) the query stored under the same key. */
  void modify(Query query);

  /** @return true if a query was removed */
  boolean remove(Query query);

  /** Removes every query owned by the connection and returns them. */
  List<Query> removeAllForConnection(String connectionId);

  /** Queries whose predicate accepts the change. */
  List<Query> selectMatching(Change change);

  /** Queries on the change's table, regardless of predicate. */
  List<Query> selectMatchingTable(Change change);

  int size();
}
