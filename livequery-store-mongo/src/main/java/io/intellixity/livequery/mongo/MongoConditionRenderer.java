package io.intellixity.livequery.mongo;

import io.intellixity.livequery.entity.Entity;
import io.intellixity.livequery.query.Clause;
import io.intellixity.livequery.query.Condition;
import io.intellixity.livequery.query.ConditionGroups;
import io.intellixity.livequery.query.LogicalGroup;
import io.intellixity.livequery.query.Operator;
import io.intellixity.livequery.query.QueryElement;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a condition chain to a MongoDB filter, grouping it exactly as the query text reads
 * ({@link ConditionGroups}). The entity id field maps to {@code _id}; an id that looks like an ObjectId
 * matches both its ObjectId and its string form.
 */
final class MongoConditionRenderer {
  private MongoConditionRenderer() {}

  static Document toBson(List<Condition> conditions) {
    QueryElement tree = ConditionGroups.group(conditions);
    return tree == null ? new Document() : render(tree);
  }

  private static Document render(QueryElement el) {
    if (el instanceof LogicalGroup g) {
      List<Document> parts = new ArrayList<>();
      for (QueryElement child : g.elements()) {
        Document d = render(child);
        if (!d.isEmpty()) parts.add(d);
      }
      if (parts.isEmpty()) return new Document();
      if (parts.size() == 1) return parts.get(0);
      return new Document(g.clause() == Clause.OR ? "$or" : "$and", parts);
    }
    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String path = path(c.field());
    return switch (c.operator()) {
      case EQUAL -> isObjectIdLike(path, c.value())
          ? new Document(path, new Document("$in", idForms((String) c.value())))
          : new Document(path, c.value());
      case NOT_EQUAL -> isObjectIdLike(path, c.value())
          ? new Document(path, new Document("$nin", idForms((String) c.value())))
          : new Document(path, new Document("$ne", c.value()));
      case MATCHES -> new Document(path,
          new Document("$regex", Operator.globToRegex(String.valueOf(c.value())).pattern()).append("$options", "s"));
    };
  }

  static String path(String field) {
    return Entity.ID_FIELD.equals(field) ? "_id" : field;
  }

  static List<Object> idForms(String id) {
    return ObjectId.isValid(id) ? List.of(new ObjectId(id), id) : List.of(id);
  }

  private static boolean isObjectIdLike(String path, Object value) {
    return "_id".equals(path) && value instanceof String s && ObjectId.isValid(s);
  }
}
