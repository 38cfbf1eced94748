package io.intellixity.livequery.entity;

import java.util.Objects;

/** Tombstone for a deleted record: carries the identifier only, every other field reads as null. */
public record DeletedEntity(String id) implements Entity {
  public DeletedEntity {
    Objects.requireNonNull(id, "id");
  }

  @Override
  public Object field(String name) {
    return ID_FIELD.equals(name) ? id : null;
  }
}
