package io.intellixity.livequery.server.web;

import com.fasterxml.jackson.core.type.TypeReference;
import io.intellixity.livequery.change.ChangeType;
import io.intellixity.livequery.channel.ClientPool;
import io.intellixity.livequery.channel.ConnectionNotFoundException;
import io.intellixity.livequery.entity.MapEntity;
import io.intellixity.livequery.notify.ChangeObserver;
import io.intellixity.livequery.notify.DefaultChangeNotifier;
import io.intellixity.livequery.protocol.ClientMethods;
import io.intellixity.livequery.protocol.ConditionDto;
import io.intellixity.livequery.protocol.ExternalChange;
import io.intellixity.livequery.protocol.HubMessage;
import io.intellixity.livequery.protocol.HubMessageCodec;
import io.intellixity.livequery.protocol.QueryDto;
import io.intellixity.livequery.protocol.ServerMethods;
import io.intellixity.livequery.registry.ConcurrentSubscriptionRegistry;
import io.intellixity.livequery.server.hub.DatabaseApiHub;
import io.intellixity.livequery.store.InMemoryEntityStore;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

final class HubWebSocketHandlerTest {
  private final HubMessageCodec codec = new HubMessageCodec();
  private final InMemoryEntityStore store = new InMemoryEntityStore();
  private final ConcurrentSubscriptionRegistry registry = new ConcurrentSubscriptionRegistry();
  private final WebSocketSessionChannel channel = new WebSocketSessionChannel(codec);
  private final DefaultChangeNotifier notifier =
      new DefaultChangeNotifier(store, registry, new ClientPool(channel), Runnable::run);
  private final HubWebSocketHandler handler =
      new HubWebSocketHandler(new DatabaseApiHub(registry, notifier), channel, codec);

  private void send(FakeWebSocketSession session, String target, QueryDto dto) throws Exception {
    handler.handleMessage(session, new TextMessage(codec.encode(target, dto)));
  }

  private List<ExternalChange> changes(String frame) {
    HubMessage m = codec.decode(frame);
    assertEquals(ClientMethods.ENTITY_CHANGED, m.target());
    return codec.argument(m, 1, new TypeReference<List<ExternalChange>>() {});
  }

  @Test
  void addQueryFrame_pushesResultsThenLiveChanges() throws Exception {
    store.subscribe(new ChangeObserver(notifier));
    store.save("Users", MapEntity.of("1", Map.of("Age", 30)));
    FakeWebSocketSession session = new FakeWebSocketSession("s1");
    handler.afterConnectionEstablished(session);

    send(session, ServerMethods.ADD_QUERY, QueryDto.of("Q1", "Users").withConditions(ConditionDto.of("Age", "=", 30)));
    store.save("Users", MapEntity.of("1", Map.of("Age", 31)));

    assertEquals(2, session.sent.size());
    List<ExternalChange> initial = changes(session.sent.get(0));
    assertEquals(ChangeType.UPSERT, initial.get(0).type());
    assertEquals("Q1", codec.argument(codec.decode(session.sent.get(0)), 0, String.class));
    List<ExternalChange> drift = changes(session.sent.get(1));
    assertEquals(ChangeType.DELETE, drift.get(0).type());
    assertEquals(31, drift.get(0).entity().field("Age"));
  }

  @Test
  void removeAndCloseDropQueries() throws Exception {
    FakeWebSocketSession session = new FakeWebSocketSession("s1");
    handler.afterConnectionEstablished(session);
    send(session, ServerMethods.ADD_QUERY, QueryDto.of("Q1", "Users"));
    send(session, ServerMethods.ADD_QUERY, QueryDto.of("Q2", "Users"));
    send(session, ServerMethods.REMOVE_QUERY, QueryDto.of("Q1", "Users"));
    assertEquals(1, registry.size());

    handler.afterConnectionClosed(session, CloseStatus.NORMAL);

    assertEquals(0, registry.size());
    assertEquals(0, channel.size());
  }

  @Test
  void malformedAndUnknownFramesAreIgnored() throws Exception {
    FakeWebSocketSession session = new FakeWebSocketSession("s1");
    handler.afterConnectionEstablished(session);

    handler.handleMessage(session, new TextMessage("{oops"));
    handler.handleMessage(session, new TextMessage("{\"target\":\"AddQuery\",\"arguments\":[]}"));
    send(session, "DropDatabase", QueryDto.of("Q1", "Users"));

    assertEquals(0, registry.size());
    assertTrue(session.sent.isEmpty());
  }

  @Test
  void channel_failsForUnknownOrClosedConnections() {
    CompletionException e = assertThrows(CompletionException.class,
        () -> channel.invoke("nope", ClientMethods.ENTITY_CHANGED, "Q1", List.of()).join());
    assertInstanceOf(ConnectionNotFoundException.class, e.getCause());

    FakeWebSocketSession session = new FakeWebSocketSession("s2");
    channel.register(session);
    session.failSends = true;
    assertThrows(CompletionException.class,
        () -> channel.invoke("s2", ClientMethods.ENTITY_CHANGED, "Q1", List.of()).join());

    session.open = false;
    e = assertThrows(CompletionException.class,
        () -> channel.invoke("s2", ClientMethods.ENTITY_CHANGED, "Q1", List.of()).join());
    assertInstanceOf(ConnectionNotFoundException.class, e.getCause());
  }
}
