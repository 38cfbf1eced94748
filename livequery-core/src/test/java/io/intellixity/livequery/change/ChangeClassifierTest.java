package io.intellixity.livequery.change;

import io.intellixity.livequery.entity.DeletedEntity;
import io.intellixity.livequery.entity.MapEntity;
import io.intellixity.livequery.store.InMemoryEntityStore;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ChangeClassifierTest {
  private final InMemoryEntityStore store = new InMemoryEntityStore();
  private final ChangeClassifier classifier = new ChangeClassifier(store);

  @Test
  void put_rereadsCurrentState() {
    store.save("Users", MapEntity.of("1", Map.of("Age", 31)));

    Change c = classifier.classify(StoreMutation.put("Users", "1"));

    assertEquals(ChangeType.UPSERT, c.type());
    assertEquals("Users", c.table());
    assertEquals(31, c.entity().field("Age"));
  }

  @Test
  void delete_buildsTombstoneWithoutRead() {
    Change c = classifier.classify(StoreMutation.delete("Users", "7"));
    assertEquals(ChangeType.DELETE, c.type());
    assertEquals(new DeletedEntity("7"), c.entity());
    assertEquals("7", c.entity().field("id"));
    assertNull(c.entity().field("Age"));

    Change t = classifier.classify(new StoreMutation("Users", "8", MutationKind.TOMBSTONE_DELETE));
    assertEquals(ChangeType.DELETE, t.type());
  }

  @Test
  void put_ofVanishedEntity_isDeletion() {
    Change c = classifier.classify(StoreMutation.put("Users", "404"));
    assertEquals(ChangeType.DELETE, c.type());
    assertEquals("404", c.entity().id());
  }

  @Test
  void unknownKinds_areRejected() {
    UnrecognizedMutationKindException e = assertThrows(UnrecognizedMutationKindException.class,
        () -> classifier.classify(new StoreMutation("Users", null, MutationKind.COLLECTION)));
    assertEquals(MutationKind.COLLECTION, e.mutation().kind());
    assertThrows(UnrecognizedMutationKindException.class,
        () -> classifier.classify(new StoreMutation("Users", "1", MutationKind.UNKNOWN)));
    assertThrows(UnrecognizedMutationKindException.class,
        () -> classifier.classify(new StoreMutation("Users", null, MutationKind.PUT)));
  }
}
