package io.intellixity.livequery.client;

/** Supplies the bearer token for each connect and reconnect attempt. */
@FunctionalInterface
public interface TokenProvider {
  String token();
}
