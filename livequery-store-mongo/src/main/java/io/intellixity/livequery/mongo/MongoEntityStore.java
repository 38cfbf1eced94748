package io.intellixity.livequery.mongo;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;
import io.intellixity.livequery.entity.Entity;
import io.intellixity.livequery.query.OrderBy;
import io.intellixity.livequery.query.PaginatedQuery;
import io.intellixity.livequery.query.Query;
import io.intellixity.livequery.store.EntityStore;
import io.intellixity.livequery.store.PageInfo;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** {@link EntityStore} over one MongoDB database; tables are collections. */
public final class MongoEntityStore implements EntityStore {
  private static final Logger log = LoggerFactory.getLogger(MongoEntityStore.class);

  private final MongoDatabase db;

  public MongoEntityStore(MongoHandle handle) {
    this.db = Objects.requireNonNull(handle, "handle").db();
  }

  @Override
  public List<Entity> findAll(Query query) {
    Document filter = MongoConditionRenderer.toBson(query.conditions());
    if (log.isDebugEnabled()) log.debug("{} -> find {}", query.toRql(), filter.toJson());
    return read(find(query, filter));
  }

  @Override
  public PageInfo findPage(PaginatedQuery query) {
    Document filter = MongoConditionRenderer.toBson(query.conditions());
    MongoCollection<Document> col = db.getCollection(query.table());
    long total = col.countDocuments(filter);
    // limit(0) means "no limit" to the driver
    if (query.size() == 0 || query.skip() >= total) {
      return new PageInfo(total, List.of(), query.page(), query.size());
    }
    List<Entity> items = read(find(query, filter).skip((int) query.skip()).limit(query.size()));
    return new PageInfo(total, items, query.page(), query.size());
  }

  @Override
  public Entity findById(String table, String id) {
    Document doc = db.getCollection(table).find(Filters.in("_id", MongoConditionRenderer.idForms(id))).first();
    return doc == null ? null : MongoDocuments.toEntity(doc);
  }

  private FindIterable<Document> find(Query query, Bson filter) {
    FindIterable<Document> find = db.getCollection(query.table()).find(filter);
    Bson sort = sort(query.orderBy());
    if (sort != null) find = find.sort(sort);
    Bson projection = projection(query.fields());
    if (projection != null) find = find.projection(projection);
    return find;
  }

  static Bson sort(OrderBy orderBy) {
    if (orderBy == null || orderBy.fields().isEmpty()) return null;
    List<String> paths = new ArrayList<>(orderBy.fields().size());
    for (String f : orderBy.fields()) paths.add(MongoConditionRenderer.path(f));
    return orderBy.ascending() ? Sorts.ascending(paths) : Sorts.descending(paths);
  }

  static Bson projection(List<String> fields) {
    if (fields == null || fields.isEmpty() || fields.contains("*")) return null;
    List<String> paths = new ArrayList<>(fields.size());
    for (String f : fields) paths.add(MongoConditionRenderer.path(f));
    return Projections.include(paths);
  }

  private static List<Entity> read(Iterable<Document> docs) {
    List<Entity> out = new ArrayList<>();
    for (Document d : docs) out.add(MongoDocuments.toEntity(d));
    return out;
  }
}
