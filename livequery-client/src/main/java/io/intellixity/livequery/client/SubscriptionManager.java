package io.intellixity.livequery.client;

import io.intellixity.livequery.entity.Entity;
import io.intellixity.livequery.protocol.QueryDto;
import io.intellixity.livequery.store.PageInfo;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Client-side registry of live queries, keyed by query name.
 * <p>
 * Query operations fail with {@link NotConnectedException} unless the manager is
 * {@link ManagerState#READY}. Registering a name that is already tracked is a no-op.
 */
public interface SubscriptionManager {
  CompletableFuture<Void> initialize();

  /** {@code onChange} receives the full merged result after every pushed batch. */
  CompletableFuture<Void> addQuery(QueryDto query, Consumer<List<Entity>> onChange);

  /** {@code onPage} receives every pushed page snapshot. */
  CompletableFuture<Void> addPageQuery(QueryDto query, Consumer<PageInfo> onPage);

  /** Replaces the stored definition; the cached result stays until the server pushes a new one. */
  CompletableFuture<Void> modifyQuery(QueryDto query);

  CompletableFuture<Void> removeQuery(String name);

  /** Re-registers every tracked query with the server, each exactly once. */
  CompletableFuture<Void> restoreSubscriptions();

  CompletableFuture<Void> dispose();

  ManagerState state();

  DatabaseStatus status();

  void registerStatusListener(String id, StatusListener listener);

  boolean unregisterStatusListener(String id);
}
