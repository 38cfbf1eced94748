package io.intellixity.livequery.entity;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Key-value view over a stored record.
 * <p>
 * The identifier is the only field the matching pipeline inspects structurally; every other field is
 * read by name through {@link #field(String)} when a condition is re-evaluated in-process, and is
 * otherwise round-tripped to clients untouched.
 */
@JsonDeserialize(as = MapEntity.class)
public interface Entity {
  String ID_FIELD = "id";

  String id();

  /** Returns the value of the named field, or null when the entity has no such field. */
  Object field(String name);
}
