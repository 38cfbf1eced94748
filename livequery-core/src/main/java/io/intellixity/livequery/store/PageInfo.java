package io.intellixity.livequery.store;

import io.intellixity.livequery.entity.Entity;

import java.util.List;

/**
 * Snapshot of a paginated query's window.
 *
 * @param total number of entities satisfying the query
 * @param items the entities of the requested window, in query order
 */
public record PageInfo(long total, List<Entity> items, int page, int size) {
  public PageInfo {
    items = List.copyOf(items == null ? List.of() : items);
  }
}
