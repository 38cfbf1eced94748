package io.intellixity.livequery.client;

import io.intellixity.livequery.protocol.HubMessage;
import io.intellixity.livequery.protocol.HubMessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link HubConnection} over a Spring {@link WebSocketClient}.
 * <p>
 * After an unexpected close the connection retries with a fixed delay until it succeeds or
 * {@link #stop()} is called. Each attempt asks the token provider for a fresh token.
 */
public final class WebSocketHubConnection extends TextWebSocketHandler implements HubConnection {
  private static final Logger log = LoggerFactory.getLogger(WebSocketHubConnection.class);

  private static final int SEND_TIME_LIMIT_MS = 10_000;
  private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

  private final WebSocketClient client;
  private final DatabaseOptions options;
  private final HubMessageCodec codec;
  private final ScheduledExecutorService scheduler;

  private final Map<String, Consumer<HubMessage>> handlers = new ConcurrentHashMap<>();
  private final List<Runnable> reconnectingHooks = new CopyOnWriteArrayList<>();
  private final List<Runnable> reconnectedHooks = new CopyOnWriteArrayList<>();
  private final List<Runnable> closedHooks = new CopyOnWriteArrayList<>();

  private volatile WebSocketSession session;
  private volatile boolean stopped = true;

  public WebSocketHubConnection(WebSocketClient client, DatabaseOptions options, HubMessageCodec codec) {
    this.client = Objects.requireNonNull(client, "client");
    this.options = Objects.requireNonNull(options, "options");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "livequery-reconnect");
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public CompletableFuture<Void> start() {
    stopped = false;
    return connect().thenApply(s -> null);
  }

  @Override
  public CompletableFuture<Void> stop() {
    stopped = true;
    WebSocketSession s = session;
    if (s == null || !s.isOpen()) {
      session = null;
      scheduler.shutdownNow();
      fire(closedHooks, "closed");
      return CompletableFuture.completedFuture(null);
    }
    try {
      s.close(CloseStatus.NORMAL);
      return CompletableFuture.completedFuture(null);
    } catch (IOException e) {
      return CompletableFuture.failedFuture(e);
    } finally {
      scheduler.shutdownNow();
    }
  }

  @Override
  public CompletableFuture<Void> send(String method, Object... arguments) {
    WebSocketSession s = session;
    if (s == null || !s.isOpen()) {
      return CompletableFuture.failedFuture(new IllegalStateException("Hub connection is not open"));
    }
    try {
      s.sendMessage(new TextMessage(codec.encode(method, arguments)));
      return CompletableFuture.completedFuture(null);
    } catch (IOException | RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public void on(String method, Consumer<HubMessage> handler) {
    handlers.put(Objects.requireNonNull(method, "method"), Objects.requireNonNull(handler, "handler"));
  }

  @Override
  public void onReconnecting(Runnable hook) { reconnectingHooks.add(Objects.requireNonNull(hook, "hook")); }

  @Override
  public void onReconnected(Runnable hook) { reconnectedHooks.add(Objects.requireNonNull(hook, "hook")); }

  @Override
  public void onClosed(Runnable hook) { closedHooks.add(Objects.requireNonNull(hook, "hook")); }

  @Override
  public String connectionId() {
    WebSocketSession s = session;
    return s == null ? null : s.getId();
  }

  @Override
  public boolean isConnected() {
    WebSocketSession s = session;
    return s != null && s.isOpen();
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession s) {
    session = new ConcurrentWebSocketSessionDecorator(s, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    log.info("Connected to {} as {}", options.url(), s.getId());
  }

  @Override
  protected void handleTextMessage(WebSocketSession s, TextMessage message) {
    HubMessage m;
    try {
      m = codec.decode(message.getPayload());
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring malformed frame: {}", e.getMessage());
      return;
    }
    Consumer<HubMessage> handler = m.target() == null ? null : handlers.get(m.target());
    if (handler == null) {
      log.debug("No handler for {}", m.target());
      return;
    }
    try {
      handler.accept(m);
    } catch (RuntimeException e) {
      log.error("Handler for {} failed", m.target(), e);
    }
  }

  @Override
  public void handleTransportError(WebSocketSession s, Throwable exception) {
    log.warn("Transport error on {}: {}", s.getId(), exception.getMessage());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession s, CloseStatus status) {
    session = null;
    if (stopped) {
      log.info("Connection {} closed", s.getId());
      fire(closedHooks, "closed");
      return;
    }
    log.warn("Connection {} lost ({}), reconnecting", s.getId(), status);
    fire(reconnectingHooks, "reconnecting");
    scheduleReconnect();
  }

  private CompletableFuture<WebSocketSession> connect() {
    CompletableFuture<WebSocketSession> attempt;
    try {
      attempt = client.execute(this, ConnectionProvider.handshakeHeaders(options.tokenProvider()), options.url());
    } catch (RuntimeException e) {
      attempt = CompletableFuture.failedFuture(e);
    }
    return attempt;
  }

  private void scheduleReconnect() {
    if (stopped) return;
    scheduler.schedule(() -> connect().whenComplete((s, error) -> {
      if (error != null) {
        log.warn("Reconnect to {} failed: {}", options.url(), error.getMessage());
        scheduleReconnect();
        return;
      }
      if (stopped) {
        closeQuietly(s);
        return;
      }
      log.info("Reconnected to {}", options.url());
      fire(reconnectedHooks, "reconnected");
    }), options.retryDelay().toMillis(), TimeUnit.MILLISECONDS);
  }

  private static void closeQuietly(WebSocketSession s) {
    try {
      s.close(CloseStatus.NORMAL);
    } catch (IOException e) {
      log.debug("Closing late session {} failed", s.getId(), e);
    }
  }

  private static void fire(List<Runnable> hooks, String event) {
    for (Runnable hook : hooks) {
      try {
        hook.run();
      } catch (RuntimeException e) {
        log.error("Connection {} hook failed", event, e);
      }
    }
  }
}
