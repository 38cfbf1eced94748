package io.intellixity.livequery.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Entity backed by an insertion-ordered field map; serializes as a plain JSON object. */
public final class MapEntity implements Entity {
  private final Map<String, Object> fields;

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public MapEntity(Map<String, Object> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
  }

  public static MapEntity of(String id, Map<String, ?> fields) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(ID_FIELD, id);
    if (fields != null) {
      fields.forEach((k, v) -> {
        if (!ID_FIELD.equals(k)) m.put(k, v);
      });
    }
    return new MapEntity(m);
  }

  @Override
  public String id() {
    Object id = fields.get(ID_FIELD);
    return id == null ? null : id.toString();
  }

  @Override
  public Object field(String name) { return fields.get(name); }

  @JsonValue
  public Map<String, Object> fields() { return fields; }

  /** Returns a copy with the given field set (or replaced). */
  public MapEntity with(String name, Object value) {
    Map<String, Object> m = new LinkedHashMap<>(fields);
    m.put(name, value);
    return new MapEntity(m);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof MapEntity e && fields.equals(e.fields));
  }

  @Override
  public int hashCode() { return fields.hashCode(); }

  @Override
  public String toString() { return fields.toString(); }
}
