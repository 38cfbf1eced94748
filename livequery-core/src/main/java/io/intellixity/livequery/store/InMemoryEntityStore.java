package io.intellixity.livequery.store;

import io.intellixity.livequery.change.StoreMutation;
import io.intellixity.livequery.entity.Entity;
import io.intellixity.livequery.entity.MapEntity;
import io.intellixity.livequery.query.ConditionEvaluator;
import io.intellixity.livequery.query.OrderBy;
import io.intellixity.livequery.query.PaginatedQuery;
import io.intellixity.livequery.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Heap-backed store with a synchronous live feed.
 * <p>
 * Writes are serialized and each write's mutation is delivered to every observer on the writing
 * thread before the next write starts, so observers see mutations in write order. Reads never wait
 * for observers.
 */
public final class InMemoryEntityStore implements EntityStore, ChangeFeed {
  private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

  private final Map<String, Map<String, Entity>> tables = new HashMap<>();
  private final Object writeLock = new Object();
  private final List<Consumer<StoreMutation>> observers = new CopyOnWriteArrayList<>();

  public void save(String table, Entity entity) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(entity, "entity");
    String id = Objects.requireNonNull(entity.id(), "entity id");
    synchronized (writeLock) {
      synchronized (tables) {
        tables.computeIfAbsent(table, t -> new LinkedHashMap<>()).put(id, entity);
      }
      publish(StoreMutation.put(table, id));
    }
  }

  public boolean delete(String table, String id) {
    synchronized (writeLock) {
      Entity removed;
      synchronized (tables) {
        Map<String, Entity> rows = tables.get(table);
        removed = rows == null ? null : rows.remove(id);
      }
      if (removed == null) return false;
      publish(StoreMutation.delete(table, id));
      return true;
    }
  }

  /** Delivers an arbitrary mutation to the observers without touching the data. */
  public void publish(StoreMutation mutation) {
    for (Consumer<StoreMutation> o : observers) o.accept(mutation);
  }

  @Override
  public Subscription subscribe(Consumer<StoreMutation> observer) {
    Objects.requireNonNull(observer, "observer");
    observers.add(observer);
    log.debug("Observer subscribed, {} active", observers.size());
    return () -> observers.remove(observer);
  }

  @Override
  public List<Entity> findAll(Query query) {
    return project(select(query), query.fields());
  }

  @Override
  public PageInfo findPage(PaginatedQuery query) {
    List<Entity> all = select(query);
    int from = (int) Math.min(query.skip(), all.size());
    int to = (int) Math.min((long) from + query.size(), all.size());
    List<Entity> window = project(all.subList(from, to), query.fields());
    return new PageInfo(all.size(), window, query.page(), query.size());
  }

  @Override
  public Entity findById(String table, String id) {
    synchronized (tables) {
      Map<String, Entity> rows = tables.get(table);
      return rows == null ? null : rows.get(id);
    }
  }

  private List<Entity> select(Query query) {
    List<Entity> rows;
    synchronized (tables) {
      Map<String, Entity> t = tables.get(query.table());
      rows = t == null ? new ArrayList<>() : new ArrayList<>(t.values());
    }
    rows.removeIf(e -> !ConditionEvaluator.test(query.conditions(), e));
    OrderBy orderBy = query.orderBy();
    if (orderBy != null && !orderBy.fields().isEmpty()) rows.sort(comparator(orderBy));
    return rows;
  }

  private static Comparator<Entity> comparator(OrderBy orderBy) {
    Comparator<Entity> c = null;
    for (String f : orderBy.fields()) {
      Comparator<Entity> byField = (a, b) -> compareValues(a.field(f), b.field(f));
      c = c == null ? byField : c.thenComparing(byField);
    }
    return orderBy.ascending() ? c : c.reversed();
  }

  // nulls, then numbers, then booleans, then strings, then anything else by string form
  @SuppressWarnings({"unchecked", "rawtypes"})
  static int compareValues(Object a, Object b) {
    if (a == b) return 0;
    int byRank = Integer.compare(rank(a), rank(b));
    if (byRank != 0) return byRank;
    if (a instanceof Number na) return Double.compare(na.doubleValue(), ((Number) b).doubleValue());
    if (a instanceof Comparable ca && a.getClass() == b.getClass()) return ca.compareTo(b);
    return a.toString().compareTo(b.toString());
  }

  private static int rank(Object v) {
    if (v == null) return 0;
    if (v instanceof Number) return 1;
    if (v instanceof Boolean) return 2;
    if (v instanceof CharSequence) return 3;
    return 4;
  }

  private static List<Entity> project(List<Entity> rows, List<String> fields) {
    if (fields == null || fields.isEmpty() || fields.contains("*")) return List.copyOf(rows);
    List<Entity> out = new ArrayList<>(rows.size());
    for (Entity e : rows) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put(Entity.ID_FIELD, e.id());
      for (String f : fields) m.put(f, e.field(f));
      out.add(new MapEntity(m));
    }
    return out;
  }
}
