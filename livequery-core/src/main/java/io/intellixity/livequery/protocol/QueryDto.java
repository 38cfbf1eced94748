package io.intellixity.livequery.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Query definition as exchanged on the wire. The connection id is never part of it: the server takes
 * it from the transport. Presence of {@code page} or {@code size} selects the paginated variant.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryDto(String name,
                       String table,
                       List<String> fields,
                       List<ConditionDto> conditions,
                       OrderByDto orderBy,
                       Integer page,
                       Integer size) {

  public static final List<String> ALL_FIELDS = List.of("*");

  public QueryDto {
    fields = (fields == null || fields.isEmpty()) ? ALL_FIELDS : List.copyOf(fields);
    conditions = conditions == null ? null : List.copyOf(conditions);
  }

  public static QueryDto of(String name, String table) {
    return new QueryDto(name, table, null, null, null, null, null);
  }

  @JsonIgnore
  public boolean isPaginated() { return page != null || size != null; }

  public QueryDto withConditions(ConditionDto... conditions) {
    return new QueryDto(name, table, fields, List.of(conditions), orderBy, page, size);
  }

  public QueryDto withFields(String... fields) {
    return new QueryDto(name, table, List.of(fields), conditions, orderBy, page, size);
  }

  public QueryDto withOrderBy(boolean ascending, String... fields) {
    return new QueryDto(name, table, this.fields, conditions, new OrderByDto(List.of(fields), ascending), page, size);
  }

  public QueryDto withPage(int page, int size) {
    return new QueryDto(name, table, fields, conditions, orderBy, page, size);
  }
}
