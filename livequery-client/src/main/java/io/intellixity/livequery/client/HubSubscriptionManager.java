package io.intellixity.livequery.client;

import com.fasterxml.jackson.core.type.TypeReference;
import io.intellixity.livequery.entity.Entity;
import io.intellixity.livequery.protocol.ClientMethods;
import io.intellixity.livequery.protocol.ExternalChange;
import io.intellixity.livequery.protocol.HubMessage;
import io.intellixity.livequery.protocol.HubMessageCodec;
import io.intellixity.livequery.protocol.QueryDto;
import io.intellixity.livequery.protocol.ServerMethods;
import io.intellixity.livequery.store.PageInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link SubscriptionManager} over a {@link HubConnection}.
 * <p>
 * Every state transition, query operation and inbound push runs as a task on one serial executor, so
 * the tracked queries are never touched concurrently and a name is registered at most once even when
 * callers race. Callbacks run on that executor too.
 */
public final class HubSubscriptionManager implements SubscriptionManager {
  private static final Logger log = LoggerFactory.getLogger(HubSubscriptionManager.class);

  private static final TypeReference<List<ExternalChange>> CHANGES = new TypeReference<>() {};

  private final HubConnection connection;
  private final HubMessageCodec codec;
  private final Executor serial;
  private final ExecutorService ownedExecutor;
  private final StatusListeners statuses = new StatusListeners();
  private final Map<String, Tracked> queries = new LinkedHashMap<>();

  private volatile ManagerState state = ManagerState.UNINITIALIZED;
  private CompletableFuture<Void> starting;
  private boolean hooksInstalled;

  public static HubSubscriptionManager create(DatabaseOptions options) {
    HubMessageCodec codec = new HubMessageCodec();
    return new HubSubscriptionManager(new ConnectionProvider(codec).create(options), codec);
  }

  public HubSubscriptionManager(HubConnection connection, HubMessageCodec codec) {
    this(connection, codec, Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "livequery-subscriptions");
      t.setDaemon(true);
      return t;
    }), true);
  }

  /** {@code serial} must run tasks one at a time in submission order. */
  public HubSubscriptionManager(HubConnection connection, HubMessageCodec codec, Executor serial) {
    this(connection, codec, serial, false);
  }

  private HubSubscriptionManager(HubConnection connection, HubMessageCodec codec, Executor serial, boolean owned) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.serial = Objects.requireNonNull(serial, "serial");
    this.ownedExecutor = owned ? (ExecutorService) serial : null;
  }

  @Override
  public CompletableFuture<Void> initialize() {
    return onSerial(() -> {
      if (state == ManagerState.READY) {
        log.warn("Subscription manager is already initialized");
        return done();
      }
      if (state == ManagerState.CONNECTING) return starting;
      if (state == ManagerState.DISPOSED) {
        return CompletableFuture.failedFuture(new IllegalStateException("Subscription manager is disposed"));
      }
      installHooks();
      state = ManagerState.CONNECTING;
      CompletableFuture<Void> connecting = new CompletableFuture<>();
      starting = connecting;
      attempt(connection::start).whenComplete((v, error) -> runSerial(() -> onStarted(connecting, error)));
      return connecting;
    });
  }

  @Override
  public CompletableFuture<Void> addQuery(QueryDto query, Consumer<List<Entity>> onChange) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(onChange, "onChange");
    return onSerial(() -> track(new Tracked(query, onChange, null)));
  }

  @Override
  public CompletableFuture<Void> addPageQuery(QueryDto query, Consumer<PageInfo> onPage) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(onPage, "onPage");
    if (!query.isPaginated()) {
      return CompletableFuture.failedFuture(new IllegalArgumentException("Query " + query.name() + " has no page or size"));
    }
    return onSerial(() -> track(new Tracked(query, null, onPage)));
  }

  @Override
  public CompletableFuture<Void> modifyQuery(QueryDto query) {
    Objects.requireNonNull(query, "query");
    return onSerial(() -> {
      if (state != ManagerState.READY) return notConnected();
      Tracked t;
      synchronized (queries) {
        t = queries.get(query.name());
        if (t == null) {
          log.warn("Query {} is not tracked, ignoring modification", query.name());
          return done();
        }
        if (t.paged() != query.isPaginated()) {
          return CompletableFuture.failedFuture(new IllegalArgumentException(
              "Query " + query.name() + " cannot switch between paginated and plain"));
        }
        t.definition = query;
      }
      return send(ServerMethods.MODIFY_QUERY, query);
    });
  }

  @Override
  public CompletableFuture<Void> removeQuery(String name) {
    Objects.requireNonNull(name, "name");
    return onSerial(() -> {
      if (state != ManagerState.READY) return notConnected();
      Tracked removed;
      synchronized (queries) {
        removed = queries.remove(name);
      }
      if (removed == null) {
        log.debug("Query {} is not tracked, nothing to remove", name);
        return done();
      }
      return send(ServerMethods.REMOVE_QUERY, removed.definition);
    });
  }

  @Override
  public CompletableFuture<Void> restoreSubscriptions() {
    return onSerial(() -> state != ManagerState.READY ? notConnected() : restore());
  }

  @Override
  public CompletableFuture<Void> dispose() {
    return onSerial(() -> {
      if (state == ManagerState.DISPOSED) return done();
      state = ManagerState.DISPOSED;
      if (starting != null) starting.cancel(false);
      synchronized (queries) {
        queries.clear();
      }
      return attempt(connection::stop).handle((v, error) -> {
        if (error != null) log.error("Closing the hub connection failed", error);
        statuses.announce(DatabaseStatus.DISCONNECTED);
        if (ownedExecutor != null) ownedExecutor.shutdown();
        log.info("Subscription manager disposed");
        return null;
      });
    });
  }

  @Override
  public ManagerState state() { return state; }

  @Override
  public DatabaseStatus status() { return statuses.current(); }

  @Override
  public void registerStatusListener(String id, StatusListener listener) {
    statuses.register(id, listener);
  }

  @Override
  public boolean unregisterStatusListener(String id) {
    return statuses.unregister(id);
  }

  public Set<String> queryNames() {
    synchronized (queries) {
      return new LinkedHashSet<>(queries.keySet());
    }
  }

  /** Current merged result of a plain query, or null when the name is not tracked. */
  public List<Entity> results(String name) {
    synchronized (queries) {
      Tracked t = queries.get(name);
      return t == null ? null : t.items;
    }
  }

  /** Latest page of a paginated query, or null before the first push. */
  public PageInfo page(String name) {
    synchronized (queries) {
      Tracked t = queries.get(name);
      return t == null ? null : t.page;
    }
  }

  private void onStarted(CompletableFuture<Void> connecting, Throwable error) {
    if (state != ManagerState.CONNECTING) {
      // disposed while connecting
      if (error == null) attempt(connection::stop);
      return;
    }
    if (error != null) {
      state = ManagerState.UNINITIALIZED;
      statuses.announce(DatabaseStatus.DISCONNECTED);
      log.error("Connecting to the hub failed", error);
      connecting.completeExceptionally(error);
      return;
    }
    state = ManagerState.READY;
    statuses.update(DatabaseStatus.CONNECTED);
    connecting.complete(null);
  }

  private void installHooks() {
    if (hooksInstalled) return;
    hooksInstalled = true;
    connection.on(ClientMethods.ENTITY_CHANGED, m -> runSerial(() -> onEntityChanged(m)));
    connection.on(ClientMethods.PAGE_CHANGED, m -> runSerial(() -> onPageChanged(m)));
    connection.onReconnecting(() -> runSerial(() -> {
      if (state == ManagerState.READY) statuses.update(DatabaseStatus.DISCONNECTED);
    }));
    connection.onReconnected(() -> runSerial(() -> {
      if (state != ManagerState.READY) return;
      statuses.update(DatabaseStatus.CONNECTED);
      restore().whenComplete((v, error) -> {
        if (error != null) log.error("Restoring subscriptions failed", error);
      });
    }));
    connection.onClosed(() -> runSerial(() -> {
      if (state == ManagerState.DISPOSED) return;
      state = ManagerState.UNINITIALIZED;
      statuses.update(DatabaseStatus.DISCONNECTED);
    }));
  }

  private CompletableFuture<Void> track(Tracked t) {
    if (state != ManagerState.READY) return notConnected();
    String name = t.definition.name();
    if (name == null || name.isBlank()) {
      return CompletableFuture.failedFuture(new IllegalArgumentException("Query name is required"));
    }
    synchronized (queries) {
      if (queries.containsKey(name)) {
        log.warn("Query {} is already tracked, ignoring", name);
        return done();
      }
      queries.put(name, t);
    }
    return send(ServerMethods.ADD_QUERY, t.definition);
  }

  /** Drops every cached result and registers each tracked definition again. */
  private CompletableFuture<Void> restore() {
    List<Tracked> current;
    synchronized (queries) {
      current = new ArrayList<>(queries.values());
      queries.clear();
    }
    log.info("Restoring {} subscriptions", current.size());
    List<CompletableFuture<Void>> sent = new ArrayList<>(current.size());
    for (Tracked t : current) sent.add(track(new Tracked(t.definition, t.onChange, t.onPage)));
    return CompletableFuture.allOf(sent.toArray(new CompletableFuture[0]));
  }

  private void onEntityChanged(HubMessage m) {
    if (state == ManagerState.DISPOSED) return;
    String name;
    List<ExternalChange> changes;
    try {
      name = codec.argument(m, 0, String.class);
      changes = codec.argument(m, 1, CHANGES);
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring malformed {}: {}", m.target(), e.getMessage());
      return;
    }
    Tracked t;
    List<Entity> merged;
    synchronized (queries) {
      t = queries.get(name);
      if (t == null || t.paged()) {
        log.debug("No plain query {} for pushed changes", name);
        return;
      }
      merged = List.copyOf(EntityCacheMerger.merge(t.items, changes));
      t.items = merged;
    }
    deliver(name, () -> t.onChange.accept(merged));
  }

  private void onPageChanged(HubMessage m) {
    if (state == ManagerState.DISPOSED) return;
    String name;
    PageInfo page;
    try {
      name = codec.argument(m, 0, String.class);
      page = codec.argument(m, 1, PageInfo.class);
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring malformed {}: {}", m.target(), e.getMessage());
      return;
    }
    Tracked t;
    synchronized (queries) {
      t = queries.get(name);
      if (t == null || !t.paged()) {
        log.debug("No paginated query {} for pushed page", name);
        return;
      }
      t.page = page;
    }
    deliver(name, () -> t.onPage.accept(page));
  }

  private static void deliver(String name, Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      log.error("Callback of query {} failed", name, e);
    }
  }

  private CompletableFuture<Void> send(String method, QueryDto query) {
    log.debug("{} {}", method, query.name());
    return attempt(() -> connection.send(method, query));
  }

  private <T> CompletableFuture<T> onSerial(Supplier<CompletableFuture<T>> task) {
    try {
      return CompletableFuture.supplyAsync(task, serial).thenCompose(Function.identity());
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(new NotConnectedException(ManagerState.DISPOSED));
    }
  }

  private void runSerial(Runnable task) {
    try {
      serial.execute(task);
    } catch (RejectedExecutionException e) {
      log.debug("Dropping connection event after disposal");
    }
  }

  private static CompletableFuture<Void> attempt(Supplier<CompletableFuture<Void>> call) {
    try {
      return call.get();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private CompletableFuture<Void> notConnected() {
    return CompletableFuture.failedFuture(new NotConnectedException(state));
  }

  private static CompletableFuture<Void> done() {
    return CompletableFuture.completedFuture(null);
  }

  private static final class Tracked {
    private QueryDto definition;
    private final Consumer<List<Entity>> onChange;
    private final Consumer<PageInfo> onPage;
    private List<Entity> items = List.of();
    private PageInfo page;

    Tracked(QueryDto definition, Consumer<List<Entity>> onChange, Consumer<PageInfo> onPage) {
      this.definition = definition;
      this.onChange = onChange;
      this.onPage = onPage;
    }

    boolean paged() { return onPage != null; }
  }
}
