package io.intellixity.livequery.server.config;

import com.mongodb.client.MongoClient;
import io.intellixity.livequery.store.ChangeFeed;
import io.intellixity.livequery.store.EntityStore;

/** The store the server queries and the live feed it watches; {@code client} is null for the in-memory store. */
public record StoreBackend(EntityStore store, ChangeFeed feed, MongoClient client) implements AutoCloseable {
  @Override
  public void close() {
    if (client != null) client.close();
  }
}
