package io.intellixity.livequery.client;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class StatusListenersTest {

  @Test
  void register_replaysCurrentStatus() {
    StatusListeners listeners = new StatusListeners();
    listeners.update(DatabaseStatus.CONNECTED);

    List<DatabaseStatus> seen = new ArrayList<>();
    listeners.register("ui", seen::add);
    assertEquals(List.of(DatabaseStatus.CONNECTED), seen);
  }

  @Test
  void update_notifiesOnlyOnChange() {
    StatusListeners listeners = new StatusListeners();
    List<DatabaseStatus> seen = new ArrayList<>();
    listeners.register("ui", seen::add);

    assertFalse(listeners.update(DatabaseStatus.DISCONNECTED));
    assertTrue(listeners.update(DatabaseStatus.CONNECTED));
    listeners.announce(DatabaseStatus.CONNECTED);
    assertEquals(List.of(DatabaseStatus.DISCONNECTED, DatabaseStatus.CONNECTED, DatabaseStatus.CONNECTED), seen);
  }

  @Test
  void duplicateId_keepsFirstListener_andUnregisterStopsDelivery() {
    StatusListeners listeners = new StatusListeners();
    List<String> seen = new ArrayList<>();
    listeners.register("ui", s -> seen.add("first:" + s));
    listeners.register("ui", s -> seen.add("second:" + s));

    assertTrue(listeners.unregister("ui"));
    assertFalse(listeners.unregister("ui"));
    listeners.update(DatabaseStatus.CONNECTED);
    assertEquals(List.of("first:DISCONNECTED"), seen);
  }

  @Test
  void failingListener_doesNotStopOthers() {
    StatusListeners listeners = new StatusListeners();
    List<DatabaseStatus> seen = new ArrayList<>();
    listeners.register("broken", s -> { throw new IllegalStateException("boom"); });
    listeners.register("ok", seen::add);

    listeners.update(DatabaseStatus.CONNECTED);
    assertEquals(List.of(DatabaseStatus.DISCONNECTED, DatabaseStatus.CONNECTED), seen);
  }
}
