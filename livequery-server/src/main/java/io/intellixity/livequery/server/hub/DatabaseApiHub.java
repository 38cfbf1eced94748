package io.intellixity.livequery.server.hub;

import io.intellixity.livequery.notify.ChangeNotifier;
import io.intellixity.livequery.protocol.QueryDto;
import io.intellixity.livequery.protocol.QueryDtos;
import io.intellixity.livequery.query.Query;
import io.intellixity.livequery.query.QueryValidationException;
import io.intellixity.livequery.registry.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Server side of the query protocol. The connection id always comes from the transport.
 * <p>
 * Registering or modifying a query pushes its complete current result; invalid definitions are logged
 * and rejected without touching the registry.
 */
public final class DatabaseApiHub {
  private static final Logger log = LoggerFactory.getLogger(DatabaseApiHub.class);

  private final SubscriptionRegistry registry;
  private final ChangeNotifier notifier;

  public DatabaseApiHub(SubscriptionRegistry registry, ChangeNotifier notifier) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
  }

  /** @return a future completing with true once the initial results were pushed, false if rejected or already registered */
  public CompletableFuture<Boolean> addQuery(String connectionId, QueryDto dto) {
    Query query = parse(connectionId, dto);
    if (query == null) return CompletableFuture.completedFuture(false);
    if (!registry.add(query)) {
      log.warn("Query {} is already registered, ignoring AddQuery", query.key());
      return CompletableFuture.completedFuture(false);
    }
    log.debug("Query added: {} [{}]", query.key(), query.toRql());
    return notifier.notifyFullResults(query);
  }

  public CompletableFuture<Boolean> modifyQuery(String connectionId, QueryDto dto) {
    Query query = parse(connectionId, dto);
    if (query == null) return CompletableFuture.completedFuture(false);
    registry.modify(query);
    log.debug("Query modified: {} [{}]", query.key(), query.toRql());
    return notifier.notifyFullResults(query);
  }

  /** Only the name of the definition is used. */
  public boolean removeQuery(String connectionId, QueryDto dto) {
    if (dto == null || dto.name() == null) {
      log.warn("RemoveQuery from {} without a query name", connectionId);
      return false;
    }
    boolean removed = registry.remove(new Query(connectionId, dto.name(), dto.table() == null ? "" : dto.table()));
    if (!removed) log.debug("RemoveQuery for unknown query {} of {}", dto.name(), connectionId);
    return removed;
  }

  public List<Query> onDisconnected(String connectionId) {
    List<Query> removed = registry.removeAllForConnection(connectionId);
    log.info("Connection {} closed, {} queries dropped", connectionId, removed.size());
    return removed;
  }

  private static Query parse(String connectionId, QueryDto dto) {
    try {
      return QueryDtos.toQuery(dto, connectionId);
    } catch (QueryValidationException e) {
      log.warn("Rejected query from {}: {}", connectionId, e.getMessage());
      return null;
    }
  }
}
