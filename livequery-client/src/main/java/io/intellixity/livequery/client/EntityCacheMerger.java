package io.intellixity.livequery.client;

import io.intellixity.livequery.change.ChangeType;
import io.intellixity.livequery.entity.Entity;
import io.intellixity.livequery.protocol.ExternalChange;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Applies a pushed change batch to the cached result of a plain query.
 * <p>
 * All deletions of the batch are applied before any upsert, whatever their order in the batch. An
 * upsert replaces the cached entity with the same id in place, or is appended.
 */
public final class EntityCacheMerger {
  private EntityCacheMerger() {}

  public static List<Entity> merge(List<Entity> cache, List<ExternalChange> changes) {
    List<Entity> out = new ArrayList<>(cache == null ? List.of() : cache);
    if (changes == null || changes.isEmpty()) return out;

    Set<String> deleted = new HashSet<>();
    for (ExternalChange c : changes) {
      if (c.type() == ChangeType.DELETE) deleted.add(c.entity().id());
    }
    if (!deleted.isEmpty()) out.removeIf(e -> deleted.contains(e.id()));

    for (ExternalChange c : changes) {
      if (c.type() != ChangeType.UPSERT) continue;
      int at = indexOf(out, c.entity().id());
      if (at >= 0) out.set(at, c.entity());
      else out.add(c.entity());
    }
    return out;
  }

  private static int indexOf(List<Entity> entities, String id) {
    for (int i = 0; i < entities.size(); i++) {
      if (Objects.equals(entities.get(i).id(), id)) return i;
    }
    return -1;
  }
}
