package io.intellixity.livequery.query;

/** Node of a grouped predicate tree: a {@link Condition} leaf or a {@link LogicalGroup}. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
