package io.intellixity.livequery.query;

import io.intellixity.livequery.entity.Entity;

import java.util.List;
import java.util.Objects;

/**
 * Evaluates a grouped predicate tree against one entity, honouring AND/OR exactly as the rendered
 * query text does. This is the store-side reading of a condition chain.
 */
public final class ConditionEvaluator implements QueryVisitor<Boolean> {
  private final Entity entity;

  private ConditionEvaluator(Entity entity) {
    this.entity = Objects.requireNonNull(entity, "entity");
  }

  public static boolean test(List<Condition> conditions, Entity entity) {
    QueryElement tree = ConditionGroups.group(conditions);
    return tree == null || tree.accept(new ConditionEvaluator(entity));
  }

  @Override
  public Boolean visit(Condition condition) {
    return condition.test(entity);
  }

  @Override
  public Boolean visit(LogicalGroup group) {
    if (group.clause() == Clause.OR) {
      for (QueryElement e : group.elements()) {
        if (e.accept(this)) return true;
      }
      return group.elements().isEmpty();
    }
    for (QueryElement e : group.elements()) {
      if (!e.accept(this)) return false;
    }
    return true;
  }
}
