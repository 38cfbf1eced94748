package io.intellixity.livequery.notify;

import io.intellixity.livequery.change.Change;
import io.intellixity.livequery.change.ChangeClassifier;
import io.intellixity.livequery.change.ChangeType;
import io.intellixity.livequery.change.StoreMutation;
import io.intellixity.livequery.change.UnrecognizedMutationKindException;
import io.intellixity.livequery.channel.ClientPool;
import io.intellixity.livequery.entity.Entity;
import io.intellixity.livequery.protocol.ClientMethods;
import io.intellixity.livequery.protocol.ExternalChange;
import io.intellixity.livequery.query.PaginatedQuery;
import io.intellixity.livequery.query.Query;
import io.intellixity.livequery.query.QueryKey;
import io.intellixity.livequery.registry.SubscriptionRegistry;
import io.intellixity.livequery.store.EntityStore;
import io.intellixity.livequery.store.PageInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Matching and fan-out pipeline.
 * <p>
 * For each mutation, queries whose predicate accepts the change get the change itself; queries on the
 * same table that no longer accept the entity get a synthesized deletion with the same entity. Paginated
 * queries never get deltas: either case re-runs their windowed fetch and pushes the whole page. Pushes
 * for different queries run independently on the fan-out executor.
 */
public final class DefaultChangeNotifier implements ChangeNotifier {
  private static final Logger log = LoggerFactory.getLogger(DefaultChangeNotifier.class);

  public static final List<String> DEFAULT_IGNORED_PREFIXES = List.of("@hilo", "system.");

  private final EntityStore store;
  private final SubscriptionRegistry registry;
  private final ClientPool clients;
  private final ChangeClassifier classifier;
  private final Executor fanout;
  private final List<String> ignoredPrefixes;

  public DefaultChangeNotifier(EntityStore store,
                               SubscriptionRegistry registry,
                               ClientPool clients,
                               Executor fanout) {
    this(store, registry, clients, new ChangeClassifier(store), fanout, DEFAULT_IGNORED_PREFIXES);
  }

  public DefaultChangeNotifier(EntityStore store,
                               SubscriptionRegistry registry,
                               ClientPool clients,
                               ChangeClassifier classifier,
                               Executor fanout,
                               List<String> ignoredPrefixes) {
    this.store = Objects.requireNonNull(store, "store");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.clients = Objects.requireNonNull(clients, "clients");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.fanout = Objects.requireNonNull(fanout, "fanout");
    this.ignoredPrefixes = ignoredPrefixes == null ? List.of() : List.copyOf(ignoredPrefixes);
  }

  @Override
  public CompletableFuture<Boolean> notifyFullResults(Query query) {
    Objects.requireNonNull(query, "query");
    if (query instanceof PaginatedQuery pq) return pushPage(pq);
    return CompletableFuture
        .supplyAsync(() -> store.findAll(query), fanout)
        .thenCompose(entities -> {
          log.debug("{} entities found for query {}", entities.size(), query.key());
          List<ExternalChange> batch = new ArrayList<>(entities.size());
          for (Entity e : entities) batch.add(new ExternalChange(e, ChangeType.UPSERT));
          return clients.invoke(ClientMethods.ENTITY_CHANGED, query.connectionId(), query.name(), batch);
        });
  }

  @Override
  public CompletableFuture<NotifyResult> notifyEntityChanged(StoreMutation mutation) {
    Objects.requireNonNull(mutation, "mutation");
    if (isIgnored(mutation.collection())) {
      log.trace("Ignoring mutation on {}", mutation.collection());
      return CompletableFuture.completedFuture(NotifyResult.NONE);
    }

    Change change;
    try {
      change = classifier.classify(mutation);
    } catch (UnrecognizedMutationKindException e) {
      log.warn("Dropping store event: {}", e.getMessage());
      return CompletableFuture.completedFuture(NotifyResult.NONE);
    }

    List<Query> direct = registry.selectMatching(change);
    Set<QueryKey> directKeys = new HashSet<>();
    for (Query q : direct) directKeys.add(q.key());

    List<Query> driftedOut = new ArrayList<>();
    for (Query q : registry.selectMatchingTable(change)) {
      if (!directKeys.contains(q.key()) && !matches(q, change)) driftedOut.add(q);
    }
    log.debug("{} {}/{}: {} matching, {} drifted out",
        change.type(), change.table(), change.entity().id(), direct.size(), driftedOut.size());

    List<CompletableFuture<Boolean>> pushes = new ArrayList<>(direct.size() + driftedOut.size());
    for (Query q : direct) pushes.add(push(q, change));
    Change deletion = change.withType(ChangeType.DELETE);
    for (Query q : driftedOut) pushes.add(push(q, deletion));

    return CompletableFuture.allOf(pushes.toArray(new CompletableFuture<?>[0]))
        .thenApply(v -> {
          int delivered = 0;
          for (CompletableFuture<Boolean> p : pushes) {
            if (Boolean.TRUE.equals(p.join())) delivered++;
          }
          return new NotifyResult(direct.size(), driftedOut.size(), delivered);
        });
  }

  private CompletableFuture<Boolean> push(Query query, Change change) {
    if (query instanceof PaginatedQuery pq) return pushPage(pq);
    List<ExternalChange> batch = List.of(ExternalChange.from(change));
    return CompletableFuture
        .supplyAsync(() -> batch, fanout)
        .thenCompose(b -> clients.invoke(ClientMethods.ENTITY_CHANGED, query.connectionId(), query.name(), b));
  }

  private CompletableFuture<Boolean> pushPage(PaginatedQuery query) {
    return CompletableFuture
        .supplyAsync(() -> store.findPage(query), fanout)
        .thenCompose(page -> sendPage(query, page))
        .exceptionally(e -> {
          log.error("Failed to fetch page {} of query {}", query.page(), query.key(), e);
          return false;
        });
  }

  private CompletableFuture<Boolean> sendPage(PaginatedQuery query, PageInfo page) {
    log.debug("Page {} of query {}: {} of {} entities", page.page(), query.key(), page.items().size(), page.total());
    return clients.invoke(ClientMethods.PAGE_CHANGED, query.connectionId(), query.name(), page);
  }

  private boolean isIgnored(String collection) {
    for (String prefix : ignoredPrefixes) {
      if (collection.startsWith(prefix)) return true;
    }
    return false;
  }

  private static boolean matches(Query query, Change change) {
    try {
      return query.matchesChange(change);
    } catch (IllegalArgumentException e) {
      log.debug("Query {} not evaluable against {}: {}", query.key(), change.entity().id(), e.getMessage());
      return false;
    }
  }
}
