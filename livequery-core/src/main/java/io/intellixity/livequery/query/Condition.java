package io.intellixity.livequery.query;

import io.intellixity.livequery.change.Change;
import io.intellixity.livequery.entity.Entity;

import java.util.Objects;

/**
 * One {@code field operator value} comparison, optionally chained to the next condition of the query
 * with {@link #joinUsing()} and wrapped in parentheses when rendered.
 */
public final class Condition implements QueryElement {
  private final String field;
  private final Operator operator;
  private final Object value;
  private final JoinOperator joinUsing;
  private final boolean leftParenthesis;
  private final boolean rightParenthesis;

  public Condition(String field,
                   Operator operator,
                   Object value,
                   JoinOperator joinUsing,
                   boolean leftParenthesis,
                   boolean rightParenthesis) {
    this.field = Objects.requireNonNull(field, "field");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = ConditionValues.normalize(value);
    this.joinUsing = joinUsing;
    this.leftParenthesis = leftParenthesis;
    this.rightParenthesis = rightParenthesis;
  }

  public static Condition of(String field, Operator operator, Object value) {
    return new Condition(field, operator, value, null, false, false);
  }

  public static Condition eq(String field, Object value) { return of(field, Operator.EQUAL, value); }
  public static Condition ne(String field, Object value) { return of(field, Operator.NOT_EQUAL, value); }
  public static Condition matches(String field, String pattern) { return of(field, Operator.MATCHES, pattern); }

  public String field() { return field; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public JoinOperator joinUsing() { return joinUsing; }
  public boolean leftParenthesis() { return leftParenthesis; }
  public boolean rightParenthesis() { return rightParenthesis; }

  public Condition and() { return joinUsing(JoinOperator.AND); }
  public Condition or() { return joinUsing(JoinOperator.OR); }

  public Condition joinUsing(JoinOperator join) {
    return new Condition(field, operator, value, join, leftParenthesis, rightParenthesis);
  }

  public Condition parenthesis(boolean left, boolean right) {
    return new Condition(field, operator, value, joinUsing, left, right);
  }

  /**
   * Re-evaluates this condition against the changed entity.
   * <p>
   * A {@link Operator#MATCHES} condition never matches an entity whose field is not a non-empty string.
   */
  public boolean match(Change change) {
    return test(change.entity());
  }

  public boolean test(Entity entity) {
    Object actual = entity.field(field);
    if (operator == Operator.MATCHES && !(actual instanceof CharSequence cs && cs.length() > 0)) return false;
    return operator.evaluate(actual, value);
  }

  /** Renders the condition followed by its join keyword, e.g. {@code (Name = 'John' and}. */
  public String render() {
    StringBuilder sb = new StringBuilder();
    if (leftParenthesis) sb.append('(');
    sb.append(operator.render(field, ConditionValues.render(value)));
    if (rightParenthesis) sb.append(')');
    if (joinUsing != null) sb.append(' ').append(joinUsing.keyword());
    return sb.toString();
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return leftParenthesis == c.leftParenthesis
        && rightParenthesis == c.rightParenthesis
        && field.equals(c.field)
        && operator == c.operator
        && Objects.equals(value, c.value)
        && joinUsing == c.joinUsing;
  }

  @Override
  public int hashCode() {
    return Objects.hash(field, operator, value, joinUsing, leftParenthesis, rightParenthesis);
  }

  @Override
  public String toString() { return render(); }
}
