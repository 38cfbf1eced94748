package io.intellixity.livequery.change;

import io.intellixity.livequery.entity.Entity;

import java.util.Objects;

/**
 * A normalized store mutation: the entity snapshot (or a tombstone for deletions), the table it lives
 * in and whether it was upserted or deleted.
 */
public record Change(Entity entity, String table, ChangeType type) {
  public Change {
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(type, "type");
  }

  public static Change upsert(Entity entity, String table) { return new Change(entity, table, ChangeType.UPSERT); }

  public Change withType(ChangeType type) { return new Change(entity, table, type); }
}
