package io.intellixity.livequery.client;

import io.intellixity.livequery.protocol.HubMessage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/** Scripted connection: records outbound calls and lets tests push frames and fire lifecycle hooks. */
final class FakeHubConnection implements HubConnection {
  record Sent(String method, List<Object> arguments) {}

  final List<Sent> sent = new ArrayList<>();
  final Map<String, Consumer<HubMessage>> handlers = new HashMap<>();
  final List<Runnable> reconnecting = new ArrayList<>();
  final List<Runnable> reconnected = new ArrayList<>();
  final List<Runnable> closed = new ArrayList<>();
  CompletableFuture<Void> startResult = CompletableFuture.completedFuture(null);
  CompletableFuture<Void> sendResult = CompletableFuture.completedFuture(null);
  RuntimeException stopFailure;
  int starts;
  int stops;
  boolean connected;

  @Override
  public CompletableFuture<Void> start() {
    starts++;
    return startResult.thenRun(() -> connected = true);
  }

  @Override
  public CompletableFuture<Void> stop() {
    stops++;
    connected = false;
    if (stopFailure != null) return CompletableFuture.failedFuture(stopFailure);
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<Void> send(String method, Object... arguments) {
    if (!connected) return CompletableFuture.failedFuture(new IllegalStateException("not open"));
    sent.add(new Sent(method, Arrays.asList(arguments)));
    return sendResult;
  }

  @Override public void on(String method, Consumer<HubMessage> handler) { handlers.put(method, handler); }
  @Override public void onReconnecting(Runnable hook) { reconnecting.add(hook); }
  @Override public void onReconnected(Runnable hook) { reconnected.add(hook); }
  @Override public void onClosed(Runnable hook) { closed.add(hook); }
  @Override public String connectionId() { return connected ? "conn-1" : null; }
  @Override public boolean isConnected() { return connected; }

  void push(String target, Object... arguments) {
    handlers.get(target).accept(new HubMessage(target, Arrays.asList(arguments)));
  }

  void drop() {
    connected = false;
    reconnecting.forEach(Runnable::run);
  }

  void restore() {
    connected = true;
    reconnected.forEach(Runnable::run);
  }

  long sentCount(String method) {
    return sent.stream().filter(s -> s.method().equals(method)).count();
  }
}
