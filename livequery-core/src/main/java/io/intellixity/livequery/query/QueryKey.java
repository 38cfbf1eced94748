package io.intellixity.livequery.query;

import java.util.Objects;

/** Identity of a subscription: query names are unique per connection. */
public record QueryKey(String name, String connectionId) {
  public QueryKey {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(connectionId, "connectionId");
  }

  @Override
  public String toString() { return name + " | " + connectionId; }
}
