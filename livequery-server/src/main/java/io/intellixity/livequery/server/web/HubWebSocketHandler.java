package io.intellixity.livequery.server.web;

import io.intellixity.livequery.protocol.HubMessage;
import io.intellixity.livequery.protocol.HubMessageCodec;
import io.intellixity.livequery.protocol.QueryDto;
import io.intellixity.livequery.protocol.ServerMethods;
import io.intellixity.livequery.server.hub.DatabaseApiHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Objects;

/** Decodes hub frames and dispatches them to {@link DatabaseApiHub} by target. */
public final class HubWebSocketHandler extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(HubWebSocketHandler.class);

  private final DatabaseApiHub hub;
  private final WebSocketSessionChannel channel;
  private final HubMessageCodec codec;

  public HubWebSocketHandler(DatabaseApiHub hub, WebSocketSessionChannel channel, HubMessageCodec codec) {
    this.hub = Objects.requireNonNull(hub, "hub");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    channel.register(session);
    log.info("Connection {} opened from {}", session.getId(), session.getRemoteAddress());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    String connectionId = session.getId();
    HubMessage frame;
    QueryDto dto;
    try {
      frame = codec.decode(message.getPayload());
      dto = codec.argument(frame, 0, QueryDto.class);
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring malformed frame from {}: {}", connectionId, e.getMessage());
      return;
    }

    switch (frame.target()) {
      case ServerMethods.ADD_QUERY -> hub.addQuery(connectionId, dto).whenComplete((ok, err) -> logFailure(frame, connectionId, err));
      case ServerMethods.MODIFY_QUERY -> hub.modifyQuery(connectionId, dto).whenComplete((ok, err) -> logFailure(frame, connectionId, err));
      case ServerMethods.REMOVE_QUERY -> hub.removeQuery(connectionId, dto);
      default -> log.warn("Unknown hub method '{}' from {}", frame.target(), connectionId);
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    channel.unregister(session.getId());
    hub.onDisconnected(session.getId());
  }

  private static void logFailure(HubMessage frame, String connectionId, Throwable err) {
    if (err != null) log.error("{} from {} failed", frame.target(), connectionId, err);
  }
}
