package io.intellixity.livequery.server.web;

import io.intellixity.livequery.channel.Channel;
import io.intellixity.livequery.channel.ConnectionNotFoundException;
import io.intellixity.livequery.protocol.HubMessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Channel} over open WebSocket sessions, addressed by session id. Sessions are wrapped so that
 * concurrent fan-out threads can send to the same connection.
 */
public final class WebSocketSessionChannel implements Channel {
  private static final Logger log = LoggerFactory.getLogger(WebSocketSessionChannel.class);

  static final int SEND_TIME_LIMIT_MILLIS = 10_000;
  static final int BUFFER_SIZE_LIMIT_BYTES = 512 * 1024;

  private final HubMessageCodec codec;
  private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

  public WebSocketSessionChannel(HubMessageCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public void register(WebSocketSession session) {
    sessions.put(session.getId(),
        new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MILLIS, BUFFER_SIZE_LIMIT_BYTES));
    log.debug("Connection {} registered", session.getId());
  }

  public void unregister(String connectionId) {
    sessions.remove(connectionId);
  }

  public int size() { return sessions.size(); }

  @Override
  public CompletableFuture<Void> invoke(String connectionId, String method, Object... arguments) {
    WebSocketSession session = sessions.get(connectionId);
    if (session == null || !session.isOpen()) {
      return CompletableFuture.failedFuture(new ConnectionNotFoundException(connectionId));
    }
    try {
      session.sendMessage(new TextMessage(codec.encode(method, arguments)));
      return CompletableFuture.completedFuture(null);
    } catch (IOException | RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}
