package io.intellixity.livequery.channel;

public final class ConnectionNotFoundException extends RuntimeException {
  private final String connectionId;

  public ConnectionNotFoundException(String connectionId) {
    super("Connection not found: " + connectionId);
    this.connectionId = connectionId;
  }

  public String connectionId() { return connectionId; }
}
