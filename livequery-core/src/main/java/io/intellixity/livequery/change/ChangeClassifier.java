package io.intellixity.livequery.change;

import io.intellixity.livequery.entity.DeletedEntity;
import io.intellixity.livequery.entity.Entity;
import io.intellixity.livequery.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns raw store mutations into {@link Change}s.
 * <p>
 * Deletions become tombstones built from the id alone. Upserts re-read the entity from the store so
 * that matching always runs against current state; an entity gone by the time it is re-read is
 * reported as deleted.
 */
public final class ChangeClassifier {
  private static final Logger log = LoggerFactory.getLogger(ChangeClassifier.class);

  private final EntityStore store;

  public ChangeClassifier(EntityStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * @throws UnrecognizedMutationKindException for mutations that are neither upserts nor deletions
   */
  public Change classify(StoreMutation mutation) {
    String table = mutation.collection();
    switch (mutation.kind()) {
      case DELETE, TOMBSTONE_DELETE -> {
        return new Change(new DeletedEntity(requireId(mutation)), table, ChangeType.DELETE);
      }
      case PUT -> {
        String id = requireId(mutation);
        Entity entity = store.findById(table, id);
        if (entity == null) {
          log.debug("Entity {}/{} vanished before it could be re-read, treating as deleted", table, id);
          return new Change(new DeletedEntity(id), table, ChangeType.DELETE);
        }
        return Change.upsert(entity, table);
      }
      default -> throw new UnrecognizedMutationKindException(mutation);
    }
  }

  private static String requireId(StoreMutation mutation) {
    if (mutation.id() == null) throw new UnrecognizedMutationKindException(mutation);
    return mutation.id();
  }
}
