package io.intellixity.livequery.change;

import java.util.Objects;

/**
 * Raw notification from the store's live feed. Only the collection, the entity id and the kind are
 * trusted; the entity itself is always re-read for upserts.
 */
public record StoreMutation(String collection, String id, MutationKind kind) {
  public StoreMutation {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(kind, "kind");
  }

  public static StoreMutation put(String collection, String id) { return new StoreMutation(collection, id, MutationKind.PUT); }
  public static StoreMutation delete(String collection, String id) { return new StoreMutation(collection, id, MutationKind.DELETE); }
}
