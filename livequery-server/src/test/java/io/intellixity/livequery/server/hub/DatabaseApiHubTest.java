package io.intellixity.livequery.server.hub;

import io.intellixity.livequery.change.Change;
import io.intellixity.livequery.channel.Channel;
import io.intellixity.livequery.channel.ClientPool;
import io.intellixity.livequery.change.ChangeType;
import io.intellixity.livequery.entity.MapEntity;
import io.intellixity.livequery.notify.DefaultChangeNotifier;
import io.intellixity.livequery.protocol.ClientMethods;
import io.intellixity.livequery.protocol.ConditionDto;
import io.intellixity.livequery.protocol.ExternalChange;
import io.intellixity.livequery.protocol.QueryDto;
import io.intellixity.livequery.registry.ConcurrentSubscriptionRegistry;
import io.intellixity.livequery.store.InMemoryEntityStore;
import io.intellixity.livequery.store.PageInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

final class DatabaseApiHubTest {

  static final class CapturingChannel implements Channel {
    final List<Object[]> sent = new ArrayList<>();

    @Override
    public CompletableFuture<Void> invoke(String connectionId, String method, Object... arguments) {
      sent.add(new Object[]{connectionId, method, arguments[0], arguments[1]});
      return CompletableFuture.completedFuture(null);
    }
  }

  private final InMemoryEntityStore store = new InMemoryEntityStore();
  private final ConcurrentSubscriptionRegistry registry = new ConcurrentSubscriptionRegistry();
  private final CapturingChannel channel = new CapturingChannel();
  private final DatabaseApiHub hub = new DatabaseApiHub(registry,
      new DefaultChangeNotifier(store, registry, new ClientPool(channel), Runnable::run));

  private static QueryDto ageQuery(int age) {
    return QueryDto.of("Q1", "Users").withConditions(ConditionDto.of("Age", "=", age));
  }

  @Test
  void addQuery_registersAndPushesInitialResults() {
    store.save("Users", MapEntity.of("1", Map.of("Age", 30)));
    store.save("Users", MapEntity.of("2", Map.of("Age", 31)));

    assertTrue(hub.addQuery("conn-1", ageQuery(30)).join());

    assertEquals(1, registry.size());
    Object[] push = channel.sent.get(0);
    assertEquals("conn-1", push[0]);
    assertEquals(ClientMethods.ENTITY_CHANGED, push[1]);
    assertEquals("Q1", push[2]);
    assertEquals(List.of(new ExternalChange(MapEntity.of("1", Map.of("Age", 30)), ChangeType.UPSERT)), push[3]);
  }

  @Test
  void addQuery_duplicateKeepsFirstDefinition() {
    hub.addQuery("conn-1", ageQuery(30)).join();
    assertFalse(hub.addQuery("conn-1", ageQuery(31)).join());

    assertEquals(1, registry.size());
    assertEquals(1, channel.sent.size());
    assertEquals(1, registry.selectMatching(Change.upsert(MapEntity.of("1", Map.of("Age", 30)), "Users")).size());
    assertTrue(registry.selectMatching(Change.upsert(MapEntity.of("1", Map.of("Age", 31)), "Users")).isEmpty());
  }

  @Test
  void addQuery_paginatedPushesPage() {
    for (int i = 1; i <= 3; i++) store.save("Items", MapEntity.of(String.valueOf(i), Map.of("Name", "item" + i)));

    hub.addQuery("conn-1", QueryDto.of("P1", "Items").withOrderBy(true, "Name").withPage(0, 2)).join();

    Object[] push = channel.sent.get(0);
    assertEquals(ClientMethods.PAGE_CHANGED, push[1]);
    PageInfo page = (PageInfo) push[3];
    assertEquals(3, page.total());
    assertEquals(2, page.items().size());
  }

  @Test
  void invalidQuery_isRejectedWithoutRegistration() {
    assertFalse(hub.addQuery("conn-1", QueryDto.of("Q1", "Users")
        .withConditions(ConditionDto.of("Age", "~", 1))).join());
    assertFalse(hub.modifyQuery("conn-1", QueryDto.of("", "Users")).join());
    assertEquals(0, registry.size());
    assertTrue(channel.sent.isEmpty());
  }

  @Test
  void modifyQuery_replacesAndResends() {
    store.save("Users", MapEntity.of("2", Map.of("Age", 31)));
    hub.addQuery("conn-1", ageQuery(30)).join();

    hub.modifyQuery("conn-1", ageQuery(31)).join();

    assertEquals(1, registry.size());
    @SuppressWarnings("unchecked")
    List<ExternalChange> batch = (List<ExternalChange>) channel.sent.get(1)[3];
    assertEquals("2", batch.get(0).entity().id());
  }

  @Test
  void removeQuery_andDisconnect() {
    hub.addQuery("conn-1", ageQuery(30)).join();
    hub.addQuery("conn-1", QueryDto.of("Q2", "Users")).join();
    hub.addQuery("conn-2", ageQuery(30)).join();

    assertTrue(hub.removeQuery("conn-1", QueryDto.of("Q2", null)));
    assertFalse(hub.removeQuery("conn-1", QueryDto.of("Q2", null)));
    assertFalse(hub.removeQuery("conn-1", null));
    assertEquals(1, hub.onDisconnected("conn-1").size());
    assertEquals(1, registry.size());
  }
}
