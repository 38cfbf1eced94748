package io.intellixity.livequery.query;

import io.intellixity.livequery.change.Change;

import java.util.List;
import java.util.Objects;

/**
 * A client's standing interest in a named, filtered view of a table.
 * <p>
 * Instances are immutable; a modified query replaces the registered one wholesale.
 */
public class Query {
  private final String connectionId;
  private final String name;
  private final String table;
  private final List<Condition> conditions;
  private final List<String> fields;
  private final OrderBy orderBy;

  public Query(String connectionId, String name, String table) {
    this(connectionId, name, table, null, null, null);
  }

  public Query(String connectionId,
               String name,
               String table,
               List<Condition> conditions,
               List<String> fields,
               OrderBy orderBy) {
    this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    this.name = Objects.requireNonNull(name, "name");
    this.table = Objects.requireNonNull(table, "table");
    this.conditions = conditions == null ? null : List.copyOf(conditions);
    this.fields = fields == null ? null : List.copyOf(fields);
    this.orderBy = orderBy;
  }

  public String connectionId() { return connectionId; }
  public String name() { return name; }
  public String table() { return table; }
  /** Null when the query declares no conditions at all. */
  public List<Condition> conditions() { return conditions; }
  /** Projection; null or empty means every field. */
  public List<String> fields() { return fields; }
  public OrderBy orderBy() { return orderBy; }

  public QueryKey key() { return new QueryKey(name, connectionId); }

  public boolean isPaginated() { return false; }

  public Query withConditions(List<Condition> conditions) {
    return new Query(connectionId, name, table, conditions, fields, orderBy);
  }

  public Query withFields(List<String> fields) {
    return new Query(connectionId, name, table, conditions, fields, orderBy);
  }

  public Query withOrderBy(OrderBy orderBy) {
    return new Query(connectionId, name, table, conditions, fields, orderBy);
  }

  public PaginatedQuery paginate(int page, int size) {
    return new PaginatedQuery(connectionId, name, table, conditions, fields, orderBy, page, size);
  }

  /**
   * True when the change happened on this query's table and every condition holds for the changed
   * entity. Conditions are combined with AND here whatever their join keywords say; the keywords only
   * drive the text handed to the store.
   */
  public boolean matchesChange(Change change) {
    if (!table.equals(change.table())) return false;
    if (conditions == null || conditions.isEmpty()) return true;
    for (Condition c : conditions) {
      if (!c.match(change)) return false;
    }
    return true;
  }

  /** Store-facing query text, see {@link QueryRenderer}. */
  public String toRql() { return QueryRenderer.render(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Query q = (Query) o;
    return connectionId.equals(q.connectionId)
        && name.equals(q.name)
        && table.equals(q.table)
        && Objects.equals(conditions, q.conditions)
        && Objects.equals(fields, q.fields)
        && Objects.equals(orderBy, q.orderBy);
  }

  @Override
  public int hashCode() {
    return Objects.hash(connectionId, name, table, conditions, fields, orderBy);
  }

  @Override
  public String toString() { return toRql(); }
}
