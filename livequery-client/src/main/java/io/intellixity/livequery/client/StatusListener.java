package io.intellixity.livequery.client;

@FunctionalInterface
public interface StatusListener {
  void onStatus(DatabaseStatus status);
}
