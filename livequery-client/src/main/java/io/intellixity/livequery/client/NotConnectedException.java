package io.intellixity.livequery.client;

/** A query operation was attempted while the manager was not {@link ManagerState#READY}. */
public final class NotConnectedException extends RuntimeException {
  public NotConnectedException(ManagerState state) {
    super("Subscription manager is not connected (state " + state + ")");
  }
}
