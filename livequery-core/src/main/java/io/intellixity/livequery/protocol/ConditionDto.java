package io.intellixity.livequery.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Condition as submitted by clients: {@code operator} is one of {@code =}, {@code <>}, {@code matches};
 * {@code joinUsing} is {@code and} / {@code or}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionDto(String field,
                           String operator,
                           Object value,
                           String joinUsing,
                           Boolean leftParenthesis,
                           Boolean rightParenthesis) {

  public static ConditionDto of(String field, String operator, Object value) {
    return new ConditionDto(field, operator, value, null, null, null);
  }

  public ConditionDto joinUsing(String joinUsing) {
    return new ConditionDto(field, operator, value, joinUsing, leftParenthesis, rightParenthesis);
  }

  public ConditionDto parenthesis(Boolean left, Boolean right) {
    return new ConditionDto(field, operator, value, joinUsing, left, right);
  }
}
