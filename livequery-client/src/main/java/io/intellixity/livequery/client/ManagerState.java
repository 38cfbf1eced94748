package io.intellixity.livequery.client;

/** Lifecycle of a {@link SubscriptionManager}; {@link #DISPOSED} is terminal. */
public enum ManagerState {
  UNINITIALIZED,
  CONNECTING,
  READY,
  DISPOSED
}
