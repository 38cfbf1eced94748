package io.intellixity.livequery.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;

import java.util.Objects;

/** Client plus the database the store reads and watches. */
public final class MongoHandle {
  private final MongoClient client;
  private final String database;

  public MongoHandle(MongoClient client, String database) {
    this.client = Objects.requireNonNull(client, "client");
    this.database = Objects.requireNonNull(database, "database");
  }

  public MongoClient client() { return client; }
  public String database() { return database; }

  public MongoDatabase db() { return client.getDatabase(database); }
}
