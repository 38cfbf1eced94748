package io.intellixity.livequery.registry;

import io.intellixity.livequery.change.Change;
import io.intellixity.livequery.entity.MapEntity;
import io.intellixity.livequery.query.Condition;
import io.intellixity.livequery.query.Query;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ConcurrentSubscriptionRegistryTest {
  private final ConcurrentSubscriptionRegistry registry = new ConcurrentSubscriptionRegistry();

  private static Query ageQuery(String connection, String name, int age) {
    return new Query(connection, name, "Users").withConditions(List.of(Condition.eq("Age", age)));
  }

  private static Change user(int age) {
    return Change.upsert(MapEntity.of("1", Map.of("Age", age)), "Users");
  }

  @Test
  void add_keepsFirstRegistrationForKey() {
    assertTrue(registry.add(ageQuery("c1", "Q1", 30)));
    assertFalse(registry.add(ageQuery("c1", "Q1", 31)));
    assertTrue(registry.add(ageQuery("c2", "Q1", 31)));

    assertEquals(2, registry.size());
    assertEquals(1, registry.selectMatching(user(30)).size());
  }

  @Test
  void modify_replacesByKey() {
    registry.add(ageQuery("c1", "Q1", 30));
    registry.modify(ageQuery("c1", "Q1", 31));

    assertTrue(registry.selectMatching(user(30)).isEmpty());
    assertEquals(1, registry.selectMatching(user(31)).size());
    assertEquals(1, registry.size());
  }

  @Test
  void remove_andRemoveAllForConnection() {
    registry.add(ageQuery("c1", "Q1", 30));
    registry.add(ageQuery("c1", "Q2", 30));
    registry.add(ageQuery("c2", "Q1", 30));

    assertTrue(registry.remove(new Query("c2", "Q1", "Users")));
    assertFalse(registry.remove(new Query("c2", "Q1", "Users")));
    assertEquals(2, registry.removeAllForConnection("c1").size());
    assertEquals(0, registry.size());
  }

  @Test
  void selectMatchingTable_ignoresPredicate() {
    registry.add(ageQuery("c1", "Q1", 30));
    registry.add(new Query("c1", "Q2", "Orders"));

    assertTrue(registry.selectMatching(user(99)).isEmpty());
    List<Query> sameTable = registry.selectMatchingTable(user(99));
    assertEquals(1, sameTable.size());
    assertEquals("Q1", sameTable.get(0).name());
  }

  @Test
  void concurrentRegistrationAndSelection() throws Exception {
    int threads = 8;
    int perThread = 200;
    ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        String conn = "c" + t;
        futures.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < perThread; i++) registry.add(ageQuery(conn, "Q" + i, 30));
          for (int i = 0; i < perThread; i += 2) registry.remove(new Query(conn, "Q" + i, "Users"));
          return null;
        }));
      }
      futures.add(pool.submit(() -> {
        start.await();
        for (int i = 0; i < 500; i++) {
          for (Query q : registry.selectMatching(user(30))) assertEquals("Users", q.table());
        }
        return null;
      }));
      start.countDown();
      for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }

    assertEquals(threads * perThread / 2, registry.size());
    assertEquals(perThread / 2, registry.removeAllForConnection("c3").size());
  }
}
