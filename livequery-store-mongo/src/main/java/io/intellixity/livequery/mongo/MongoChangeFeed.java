package io.intellixity.livequery.mongo;

import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.OperationType;
import io.intellixity.livequery.change.MutationKind;
import io.intellixity.livequery.change.StoreMutation;
import io.intellixity.livequery.store.ChangeFeed;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Live feed over a database-wide change stream.
 * <p>
 * Each subscription watches on its own daemon thread and delivers mutations in stream order. A failed
 * stream is reopened after a delay, resuming after the last delivered event.
 */
public final class MongoChangeFeed implements ChangeFeed {
  private static final Logger log = LoggerFactory.getLogger(MongoChangeFeed.class);

  private final MongoDatabase db;
  private final long retryDelayMillis;

  public MongoChangeFeed(MongoHandle handle) {
    this(handle, 1000);
  }

  public MongoChangeFeed(MongoHandle handle, long retryDelayMillis) {
    this.db = Objects.requireNonNull(handle, "handle").db();
    this.retryDelayMillis = retryDelayMillis;
  }

  @Override
  public Subscription subscribe(Consumer<StoreMutation> observer) {
    Watcher w = new Watcher(Objects.requireNonNull(observer, "observer"));
    Thread t = new Thread(w, "livequery-mongo-feed-" + db.getName());
    t.setDaemon(true);
    t.start();
    return w::close;
  }

  /** Maps a change-stream event; only the collection, the document key and the operation are used. */
  static StoreMutation toMutation(ChangeStreamDocument<Document> event) {
    BsonDocument ns = event.getNamespaceDocument();
    String collection = ns != null && ns.containsKey("coll") ? ns.getString("coll").getValue() : "";
    BsonDocument key = event.getDocumentKey();
    return toMutation(event.getOperationType(), collection, key == null ? null : key.get("_id"));
  }

  static StoreMutation toMutation(OperationType operation, String collection, BsonValue id) {
    MutationKind kind;
    if (operation == null) {
      kind = MutationKind.UNKNOWN;
    } else {
      kind = switch (operation) {
        case INSERT, UPDATE, REPLACE -> MutationKind.PUT;
        case DELETE -> MutationKind.DELETE;
        case DROP, RENAME, DROP_DATABASE, INVALIDATE -> MutationKind.COLLECTION;
        default -> MutationKind.UNKNOWN;
      };
    }
    return new StoreMutation(collection, MongoDocuments.idString(id), kind);
  }

  private final class Watcher implements Runnable {
    private final Consumer<StoreMutation> observer;
    private volatile boolean running = true;
    private volatile MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor;
    private BsonDocument resumeToken;

    Watcher(Consumer<StoreMutation> observer) {
      this.observer = observer;
    }

    @Override
    public void run() {
      log.info("Watching database {}", db.getName());
      while (running) {
        try (MongoChangeStreamCursor<ChangeStreamDocument<Document>> c = open()) {
          cursor = c;
          while (running) {
            ChangeStreamDocument<Document> event = c.tryNext();
            if (event == null) continue;
            resumeToken = event.getResumeToken();
            deliver(event);
          }
        } catch (RuntimeException e) {
          if (!running) break;
          log.error("Change stream on {} failed, reopening in {} ms", db.getName(), retryDelayMillis, e);
          pause();
        }
      }
      log.info("Stopped watching database {}", db.getName());
    }

    private MongoChangeStreamCursor<ChangeStreamDocument<Document>> open() {
      ChangeStreamIterable<Document> stream = db.watch().maxAwaitTime(1, TimeUnit.SECONDS);
      if (resumeToken != null) stream = stream.resumeAfter(resumeToken);
      return stream.cursor();
    }

    private void deliver(ChangeStreamDocument<Document> event) {
      StoreMutation m = toMutation(event);
      try {
        observer.accept(m);
      } catch (RuntimeException e) {
        log.error("Observer failed for {}", m, e);
      }
    }

    private void pause() {
      try {
        Thread.sleep(retryDelayMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        running = false;
      }
    }

    void close() {
      running = false;
      MongoChangeStreamCursor<ChangeStreamDocument<Document>> c = cursor;
      if (c == null) return;
      try {
        c.close();
      } catch (RuntimeException e) {
        log.debug("Change stream cursor close failed", e);
      }
    }
  }
}
