package io.intellixity.livequery.client;

import io.intellixity.livequery.protocol.HubMessage;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Client end of the hub channel. Implementations reconnect on their own after an unexpected drop and
 * report it through the lifecycle hooks; {@link #onClosed(Runnable)} fires once the channel is closed
 * for good.
 */
public interface HubConnection {
  CompletableFuture<Void> start();

  CompletableFuture<Void> stop();

  CompletableFuture<Void> send(String method, Object... arguments);

  /** Routes inbound messages whose target is {@code method}; a later registration replaces the earlier one. */
  void on(String method, Consumer<HubMessage> handler);

  void onReconnecting(Runnable hook);

  void onReconnected(Runnable hook);

  void onClosed(Runnable hook);

  String connectionId();

  boolean isConnected();
}
