package io.intellixity.livequery.query;

import java.util.List;
import java.util.Objects;

/**
 * A {@link Query} whose results are delivered as a window: {@code size} entities starting at
 * {@code page * size}. Subscribers of paginated queries only ever receive full-window snapshots.
 */
public final class PaginatedQuery extends Query {
  private final int page;
  private final int size;

  public PaginatedQuery(String connectionId, String name, String table, int page, int size) {
    this(connectionId, name, table, null, null, null, page, size);
  }

  public PaginatedQuery(String connectionId,
                        String name,
                        String table,
                        List<Condition> conditions,
                        List<String> fields,
                        OrderBy orderBy,
                        int page,
                        int size) {
    super(connectionId, name, table, conditions, fields, orderBy);
    if (page < 0) throw new IllegalArgumentException("page must be >= 0");
    if (size < 0) throw new IllegalArgumentException("size must be >= 0");
    this.page = page;
    this.size = size;
  }

  public int page() { return page; }
  public int size() { return size; }

  /** Number of entities to skip before the window starts. */
  public long skip() { return (long) page * size; }

  @Override
  public boolean isPaginated() { return true; }

  @Override
  public PaginatedQuery withConditions(List<Condition> conditions) {
    return new PaginatedQuery(connectionId(), name(), table(), conditions, fields(), orderBy(), page, size);
  }

  @Override
  public PaginatedQuery withFields(List<String> fields) {
    return new PaginatedQuery(connectionId(), name(), table(), conditions(), fields, orderBy(), page, size);
  }

  @Override
  public PaginatedQuery withOrderBy(OrderBy orderBy) {
    return new PaginatedQuery(connectionId(), name(), table(), conditions(), fields(), orderBy, page, size);
  }

  @Override
  public boolean equals(Object o) {
    if (!super.equals(o)) return false;
    PaginatedQuery p = (PaginatedQuery) o;
    return page == p.page && size == p.size;
  }

  @Override
  public int hashCode() { return Objects.hash(super.hashCode(), page, size); }
}
