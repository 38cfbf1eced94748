package io.intellixity.livequery.query;

import java.util.List;

/** Ordering of query results: the fields to sort by, all ascending or all descending. */
public record OrderBy(List<String> fields, boolean ascending) {
  public OrderBy {
    fields = List.copyOf(fields == null ? List.of() : fields);
  }

  public static OrderBy ascending(String... fields) { return new OrderBy(List.of(fields), true); }
  public static OrderBy descending(String... fields) { return new OrderBy(List.of(fields), false); }
}
