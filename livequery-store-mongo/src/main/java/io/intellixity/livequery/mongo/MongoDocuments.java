package io.intellixity.livequery.mongo;

import io.intellixity.livequery.entity.Entity;
import io.intellixity.livequery.entity.MapEntity;
import io.intellixity.livequery.query.ConditionValues;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document to {@link Entity} conversion: {@code _id} becomes {@code id}, ObjectIds become hex strings and
 * numbers are normalized like condition values.
 */
final class MongoDocuments {
  private MongoDocuments() {}

  static Entity toEntity(Document doc) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(Entity.ID_FIELD, idString(doc.get("_id")));
    for (Map.Entry<String, Object> e : doc.entrySet()) {
      if ("_id".equals(e.getKey())) continue;
      fields.put(e.getKey(), plain(e.getValue()));
    }
    return new MapEntity(fields);
  }

  static String idString(Object id) {
    if (id == null) return null;
    if (id instanceof ObjectId oid) return oid.toHexString();
    return id.toString();
  }

  static String idString(BsonValue id) {
    if (id == null) return null;
    if (id.isObjectId()) return id.asObjectId().getValue().toHexString();
    if (id.isString()) return id.asString().getValue();
    if (id.isInt32()) return String.valueOf(id.asInt32().getValue());
    if (id.isInt64()) return String.valueOf(id.asInt64().getValue());
    return id.toString();
  }

  private static Object plain(Object v) {
    if (v instanceof ObjectId oid) return oid.toHexString();
    if (v instanceof Number) return ConditionValues.normalize(v);
    if (v instanceof Document d) {
      Map<String, Object> m = new LinkedHashMap<>();
      d.forEach((k, x) -> m.put(k, plain(x)));
      return m;
    }
    if (v instanceof List<?> list) {
      List<Object> out = new ArrayList<>(list.size());
      for (Object x : list) out.add(plain(x));
      return out;
    }
    return v;
  }
}
