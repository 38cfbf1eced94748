package io.intellixity.livequery.query;

import java.util.List;

/**
 * Renders a {@link Query} to the text handed to the store, e.g.
 * <pre>
 * from Users where (Age = 30 or Age = 31) and Name matches 'J*' order by Name desc select Name, Age
 * </pre>
 * A projection of just {@code *} is the same as no projection and is not rendered.
 */
public final class QueryRenderer {
  private QueryRenderer() {}

  public static String render(Query query) {
    StringBuilder sb = new StringBuilder("from ").append(query.table());

    List<Condition> conditions = query.conditions();
    if (conditions != null && !conditions.isEmpty()) {
      sb.append(" where");
      for (Condition c : conditions) sb.append(' ').append(c.render());
    }

    OrderBy orderBy = query.orderBy();
    if (orderBy != null && !orderBy.fields().isEmpty()) {
      sb.append(" order by ").append(String.join(", ", orderBy.fields()));
      if (!orderBy.ascending()) sb.append(" desc");
    }

    List<String> fields = query.fields();
    if (fields != null && !fields.isEmpty() && !List.of("*").equals(fields)) {
      sb.append(" select ").append(String.join(", ", fields));
    }
    return sb.toString();
  }
}
