package io.intellixity.livequery.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.livequery.query.Condition;
import io.intellixity.livequery.query.JoinOperator;
import io.intellixity.livequery.query.Operator;
import io.intellixity.livequery.query.PaginatedQuery;
import io.intellixity.livequery.query.Query;
import io.intellixity.livequery.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryDtosTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesPlainQueryFromJson() throws Exception {
    String s = """
        {
          "name": "Q1",
          "table": "Users",
          "conditions": [
            { "field": "Age", "operator": "=", "value": 30, "joinUsing": "or" },
            { "field": "Name", "operator": "matches", "value": "J*" }
          ],
          "orderBy": { "fields": ["Name"], "ascending": false }
        }
        """;
    QueryDto dto = JSON.readValue(s, QueryDto.class);
    assertEquals(List.of("*"), dto.fields());
    assertFalse(dto.isPaginated());

    Query q = QueryDtos.toQuery(dto, "conn-1");
    assertFalse(q instanceof PaginatedQuery);
    assertEquals("conn-1", q.connectionId());
    assertEquals("Users", q.table());
    assertEquals(2, q.conditions().size());

    Condition age = q.conditions().get(0);
    assertEquals(Operator.EQUAL, age.operator());
    assertEquals(30L, age.value());
    assertEquals(JoinOperator.OR, age.joinUsing());
    assertEquals(Operator.MATCHES, q.conditions().get(1).operator());
    assertFalse(q.orderBy().ascending());
    assertEquals("from Users where Age = 30 or Name matches 'J*' order by Name desc", q.toRql());
  }

  @Test
  void pageOrSizeSelectsPaginatedVariant() throws Exception {
    QueryDto dto = JSON.readValue("{\"name\":\"Q1\",\"table\":\"Users\",\"page\":1,\"size\":2}", QueryDto.class);
    PaginatedQuery q = assertInstanceOf(PaginatedQuery.class, QueryDtos.toQuery(dto, "c"));
    assertEquals(1, q.page());
    assertEquals(2, q.size());

    PaginatedQuery sizeOnly = assertInstanceOf(PaginatedQuery.class,
        QueryDtos.toQuery(QueryDto.of("Q2", "Users").withPage(0, 5), "c"));
    assertEquals(0, sizeOnly.page());
  }

  @Test
  void rejectsInvalidDefinitions() {
    assertThrows(QueryValidationException.class, () -> QueryDtos.toQuery(null, "c"));
    assertThrows(QueryValidationException.class, () -> QueryDtos.toQuery(QueryDto.of(" ", "Users"), "c"));
    assertThrows(QueryValidationException.class, () -> QueryDtos.toQuery(QueryDto.of("Q1", null), "c"));
    assertThrows(QueryValidationException.class, () -> QueryDtos.toQuery(QueryDto.of("Q1", "Users").withPage(-1, 2), "c"));

    QueryValidationException e = assertThrows(QueryValidationException.class, () -> QueryDtos.toQuery(
        QueryDto.of("Q1", "Users").withConditions(ConditionDto.of("Age", ">", 3)), "c"));
    assertTrue(e.getMessage().contains("Q1"));

    assertThrows(QueryValidationException.class, () -> QueryDtos.toQuery(
        QueryDto.of("Q1", "Users").withConditions(ConditionDto.of("Name", "matches", 3)), "c"));
    assertThrows(QueryValidationException.class, () -> QueryDtos.toQuery(
        QueryDto.of("Q1", "Users").withConditions(ConditionDto.of("Name", "=", "x").joinUsing("xor")), "c"));
  }

  @Test
  void serializesWithoutAbsentMembers() throws Exception {
    String s = JSON.writeValueAsString(QueryDto.of("Q1", "Users").withConditions(ConditionDto.of("Age", "=", 30)));
    assertFalse(s.contains("page"));
    assertFalse(s.contains("joinUsing"));
    assertFalse(s.contains("paginated"));
    assertEquals(QueryDto.of("Q1", "Users").withConditions(ConditionDto.of("Age", "=", 30)), JSON.readValue(s, QueryDto.class));
  }
}
