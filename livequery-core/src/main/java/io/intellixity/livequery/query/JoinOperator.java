package io.intellixity.livequery.query;

import java.util.Locale;

/** Keyword chaining a condition to the next one in a query. */
public enum JoinOperator {
  AND("and"),
  OR("or");

  private final String keyword;

  JoinOperator(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() { return keyword; }

  public Clause clause() { return this == OR ? Clause.OR : Clause.AND; }

  public static JoinOperator parse(String raw) {
    if (raw == null) throw new QueryValidationException("Join operator is required");
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "and" -> AND;
      case "or" -> OR;
      default -> throw new QueryValidationException("Unknown join operator: '" + raw + "'");
    };
  }
}
