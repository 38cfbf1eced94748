package io.intellixity.livequery.registry;

import io.intellixity.livequery.change.Change;
import io.intellixity.livequery.query.Query;
import io.intellixity.livequery.query.QueryKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** {@link SubscriptionRegistry} over a {@link ConcurrentHashMap}; selections iterate a weakly consistent view. */
public final class ConcurrentSubscriptionRegistry implements SubscriptionRegistry {
  private static final Logger log = LoggerFactory.getLogger(ConcurrentSubscriptionRegistry.class);

  private final Map<QueryKey, Query> queries = new ConcurrentHashMap<>();

  @Override
  public boolean add(Query query) {
    Objects.requireNonNull(query, "query");
    boolean added = queries.putIfAbsent(query.key(), query) == null;
    if (added) log.debug("Query added: {}", query.key());
    return added;
  }

  @Override
  public void modify(Query query) {
    Objects.requireNonNull(query, "query");
    queries.put(query.key(), query);
    log.debug("Query modified: {}", query.key());
  }

  @Override
  public boolean remove(Query query) {
    Objects.requireNonNull(query, "query");
    return queries.remove(query.key()) != null;
  }

  @Override
  public List<Query> removeAllForConnection(String connectionId) {
    List<Query> removed = new ArrayList<>();
    Iterator<Map.Entry<QueryKey, Query>> it = queries.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<QueryKey, Query> e = it.next();
      if (e.getKey().connectionId().equals(connectionId)) {
        removed.add(e.getValue());
        it.remove();
      }
    }
    log.debug("Removed {} queries of connection {}", removed.size(), connectionId);
    return removed;
  }

  @Override
  public List<Query> selectMatching(Change change) {
    List<Query> out = new ArrayList<>();
    for (Query q : queries.values()) {
      if (safeMatches(q, change)) out.add(q);
    }
    return out;
  }

  @Override
  public List<Query> selectMatchingTable(Change change) {
    List<Query> out = new ArrayList<>();
    for (Query q : queries.values()) {
      if (q.table().equals(change.table())) out.add(q);
    }
    return out;
  }

  @Override
  public int size() { return queries.size(); }

  /**
   * Evaluates the query's predicate; a predicate that cannot be evaluated against this change counts
   * as a non-match so one bad query does not stop the others from being notified.
   */
  static boolean safeMatches(Query query, Change change) {
    try {
      return query.matchesChange(change);
    } catch (IllegalArgumentException e) {
      log.warn("Query {} could not be evaluated against {}/{}: {}",
          query.key(), change.table(), change.entity().id(), e.getMessage());
      return false;
    }
  }
}
