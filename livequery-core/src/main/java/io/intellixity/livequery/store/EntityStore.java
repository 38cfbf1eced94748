package io.intellixity.livequery.store;

import io.intellixity.livequery.entity.Entity;
import io.intellixity.livequery.query.PaginatedQuery;
import io.intellixity.livequery.query.Query;

import java.util.List;

/** Query side of the backing store. */
public interface EntityStore {
  /** Runs the query (filter, order, projection) and returns every matching entity. */
  List<Entity> findAll(Query query);

  /** Runs the query for the window {@code [page * size, page * size + size)} and counts all matches. */
  PageInfo findPage(PaginatedQuery query);

  /** Reads the current state of one entity, or null when it no longer exists. */
  Entity findById(String table, String id);
}
