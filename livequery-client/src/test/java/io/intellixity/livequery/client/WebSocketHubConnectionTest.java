package io.intellixity.livequery.client;

import io.intellixity.livequery.protocol.HubMessage;
import io.intellixity.livequery.protocol.HubMessageCodec;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class WebSocketHubConnectionTest {

  private static WebSocketHubConnection connection() {
    return new WebSocketHubConnection(new StandardWebSocketClient(),
        DatabaseOptions.of("ws://localhost:5000/hub"), new HubMessageCodec());
  }

  @Test
  void send_beforeConnect_fails() {
    WebSocketHubConnection c = connection();
    assertFalse(c.isConnected());
    assertNull(c.connectionId());
    CompletionException e = assertThrows(CompletionException.class, () -> c.send("AddQuery", "x").join());
    assertInstanceOf(IllegalStateException.class, e.getCause());
  }

  @Test
  void send_writesFrame() {
    WebSocketHubConnection c = connection();
    FakeWebSocketSession session = new FakeWebSocketSession("s1");
    c.afterConnectionEstablished(session);

    assertTrue(c.isConnected());
    assertEquals("s1", c.connectionId());
    c.send("RemoveQuery", "Q1").join();
    assertEquals(List.of("{\"target\":\"RemoveQuery\",\"arguments\":[\"Q1\"]}"), session.sent);
  }

  @Test
  void inboundFrames_routeByTarget() throws Exception {
    WebSocketHubConnection c = connection();
    FakeWebSocketSession session = new FakeWebSocketSession("s1");
    c.afterConnectionEstablished(session);
    List<HubMessage> got = new ArrayList<>();
    c.on("entityChanged", got::add);

    c.handleMessage(session, new TextMessage("{\"target\":\"entityChanged\",\"arguments\":[\"Q1\",[]]}"));
    c.handleMessage(session, new TextMessage("{\"target\":\"somethingElse\",\"arguments\":[]}"));
    c.handleMessage(session, new TextMessage("not json"));

    assertEquals(1, got.size());
    assertEquals("Q1", got.get(0).arguments().get(0));
  }

  @Test
  void closeAfterStop_firesClosedHooks() throws Exception {
    WebSocketHubConnection c = connection();
    FakeWebSocketSession session = new FakeWebSocketSession("s1");
    c.afterConnectionEstablished(session);
    AtomicInteger closed = new AtomicInteger();
    AtomicInteger reconnecting = new AtomicInteger();
    c.onClosed(closed::incrementAndGet);
    c.onReconnecting(reconnecting::incrementAndGet);

    c.stop().join();
    assertFalse(session.open);
    c.afterConnectionClosed(session, CloseStatus.NORMAL);

    assertEquals(1, closed.get());
    assertEquals(0, reconnecting.get());
    assertFalse(c.isConnected());
  }
}
