package io.intellixity.livequery.protocol;

import io.intellixity.livequery.query.Condition;
import io.intellixity.livequery.query.JoinOperator;
import io.intellixity.livequery.query.Operator;
import io.intellixity.livequery.query.OrderBy;
import io.intellixity.livequery.query.PaginatedQuery;
import io.intellixity.livequery.query.Query;
import io.intellixity.livequery.query.QueryValidationException;

import java.util.ArrayList;
import java.util.List;

/** Explicit conversion of client-submitted {@link QueryDto}s into domain {@link Query} objects. */
public final class QueryDtos {
  private QueryDtos() {}

  /**
   * @throws QueryValidationException when the definition is incomplete or uses unknown operators
   */
  public static Query toQuery(QueryDto dto, String connectionId) {
    if (dto == null) throw new QueryValidationException("Query definition is required");
    String name = requireText(dto.name(), "Query name");
    String table = requireText(dto.table(), "Query '" + name + "' table");

    List<Condition> conditions = dto.conditions() == null ? null : toConditions(name, dto.conditions());
    OrderBy orderBy = toOrderBy(dto.orderBy());

    if (dto.isPaginated()) {
      int page = dto.page() == null ? 0 : dto.page();
      int size = dto.size() == null ? 0 : dto.size();
      if (page < 0) throw new QueryValidationException("Query '" + name + "' page must be >= 0");
      if (size < 0) throw new QueryValidationException("Query '" + name + "' size must be >= 0");
      return new PaginatedQuery(connectionId, name, table, conditions, dto.fields(), orderBy, page, size);
    }
    return new Query(connectionId, name, table, conditions, dto.fields(), orderBy);
  }

  public static Condition toCondition(ConditionDto dto) {
    if (dto == null) throw new QueryValidationException("Condition must not be null");
    String field = requireText(dto.field(), "Condition field");
    Operator operator = Operator.parse(dto.operator());
    JoinOperator join = dto.joinUsing() == null ? null : JoinOperator.parse(dto.joinUsing());

    if (operator == Operator.MATCHES && !(dto.value() instanceof String s && !s.isEmpty())) {
      throw new QueryValidationException("'matches' on field '" + field + "' requires a non-empty string pattern");
    }
    return new Condition(
        field,
        operator,
        dto.value(),
        join,
        Boolean.TRUE.equals(dto.leftParenthesis()),
        Boolean.TRUE.equals(dto.rightParenthesis()));
  }

  private static List<Condition> toConditions(String queryName, List<ConditionDto> dtos) {
    List<Condition> out = new ArrayList<>(dtos.size());
    for (int i = 0; i < dtos.size(); i++) {
      try {
        out.add(toCondition(dtos.get(i)));
      } catch (QueryValidationException e) {
        throw new QueryValidationException("Query '" + queryName + "' condition #" + i + ": " + e.getMessage(), e);
      }
    }
    return out;
  }

  private static OrderBy toOrderBy(OrderByDto dto) {
    if (dto == null) return null;
    return new OrderBy(dto.fields(), dto.ascendingOrDefault());
  }

  private static String requireText(String s, String label) {
    if (s == null || s.isBlank()) throw new QueryValidationException(label + " is required");
    return s;
  }
}
