package io.intellixity.livequery.client;

public enum DatabaseStatus {
  CONNECTED,
  DISCONNECTED
}
