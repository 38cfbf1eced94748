package io.intellixity.livequery.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Connection status observers keyed by id. A newly registered listener immediately receives the
 * current status; afterwards listeners hear only actual changes.
 */
public final class StatusListeners {
  private static final Logger log = LoggerFactory.getLogger(StatusListeners.class);

  private final Map<String, StatusListener> listeners = new LinkedHashMap<>();
  private DatabaseStatus current = DatabaseStatus.DISCONNECTED;

  /** Registering an id twice keeps the first listener. */
  public void register(String id, StatusListener listener) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(listener, "listener");
    DatabaseStatus status;
    synchronized (this) {
      if (listeners.putIfAbsent(id, listener) != null) return;
      status = current;
    }
    deliver(id, listener, status);
  }

  public synchronized boolean unregister(String id) {
    return listeners.remove(id) != null;
  }

  public synchronized DatabaseStatus current() { return current; }

  /** @return true if the status changed and listeners were notified */
  public boolean update(DatabaseStatus status) {
    return update(status, false);
  }

  /** Notifies every listener of {@code status} even when it is the current one. */
  public void announce(DatabaseStatus status) {
    update(status, true);
  }

  private boolean update(DatabaseStatus status, boolean always) {
    Objects.requireNonNull(status, "status");
    List<Map.Entry<String, StatusListener>> targets;
    synchronized (this) {
      if (current == status && !always) return false;
      current = status;
      targets = new ArrayList<>(listeners.entrySet());
    }
    log.info("Database status: {}", status);
    for (Map.Entry<String, StatusListener> e : targets) deliver(e.getKey(), e.getValue(), status);
    return true;
  }

  private static void deliver(String id, StatusListener listener, DatabaseStatus status) {
    try {
      listener.onStatus(status);
    } catch (RuntimeException e) {
      log.error("Status listener '{}' failed", id, e);
    }
  }
}
