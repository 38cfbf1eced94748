package io.intellixity.livequery.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a predicate tree from a flat condition chain, reading it the way the rendered text reads:
 * parenthesis markers open and close groups, AND binds tighter than OR, and a missing join keyword
 * between two conditions means AND. The join keyword of the last condition is ignored.
 * <p>
 * Unbalanced markers are tolerated: a stray closing parenthesis is dropped and groups still open at
 * the end of the chain are closed there.
 */
public final class ConditionGroups {
  private ConditionGroups() {}

  /** Returns the tree for the chain, or null for a null or empty chain. */
  public static QueryElement group(List<Condition> conditions) {
    if (conditions == null || conditions.isEmpty()) return null;
    return new Parser(tokenize(conditions)).parse();
  }

  private enum Kind { OPEN, CLOSE, CONDITION, AND, OR }

  private record Token(Kind kind, Condition condition) {}

  private static List<Token> tokenize(List<Condition> conditions) {
    List<Token> tokens = new ArrayList<>();
    for (int i = 0; i < conditions.size(); i++) {
      Condition c = conditions.get(i);
      if (c.leftParenthesis()) tokens.add(new Token(Kind.OPEN, null));
      tokens.add(new Token(Kind.CONDITION, c));
      if (c.rightParenthesis()) tokens.add(new Token(Kind.CLOSE, null));
      if (i < conditions.size() - 1) {
        tokens.add(new Token(c.joinUsing() == JoinOperator.OR ? Kind.OR : Kind.AND, null));
      }
    }
    return tokens;
  }

  private static final class Parser {
    private final List<Token> tokens;
    private int pos;
    private int depth;

    Parser(List<Token> tokens) {
      this.tokens = tokens;
    }

    QueryElement parse() {
      QueryElement root = or();
      while (pos < tokens.size()) {
        // Left over after a group closed twice: skip the marker and keep chaining.
        pos++;
        if (peek() == Kind.AND || peek() == Kind.OR) {
          Clause clause = tokens.get(pos++).kind() == Kind.OR ? Clause.OR : Clause.AND;
          root = collapse(clause, List.of(root, or()));
        }
      }
      return root;
    }

    private QueryElement or() {
      List<QueryElement> terms = new ArrayList<>();
      terms.add(and());
      while (peek() == Kind.OR) {
        pos++;
        terms.add(and());
      }
      return collapse(Clause.OR, terms);
    }

    private QueryElement and() {
      List<QueryElement> factors = new ArrayList<>();
      factors.add(factor());
      while (peek() == Kind.AND) {
        pos++;
        factors.add(factor());
      }
      return collapse(Clause.AND, factors);
    }

    private QueryElement factor() {
      Token t = tokens.get(pos++);
      if (t.kind() == Kind.OPEN) {
        depth++;
        QueryElement inner = or();
        if (peek() == Kind.CLOSE) pos++;
        depth--;
        return inner;
      }
      QueryElement c = t.condition();
      // A closing marker directly after a condition that never opened a group.
      while (depth == 0 && peek() == Kind.CLOSE) pos++;
      return c;
    }

    private Kind peek() {
      return pos < tokens.size() ? tokens.get(pos).kind() : null;
    }

    private static QueryElement collapse(Clause clause, List<QueryElement> elements) {
      if (elements.size() == 1) return elements.get(0);
      List<QueryElement> flat = new ArrayList<>();
      for (QueryElement e : elements) {
        if (e instanceof LogicalGroup g && g.clause() == clause) flat.addAll(g.elements());
        else flat.add(e);
      }
      return new LogicalGroup(clause, flat);
    }
  }
}
