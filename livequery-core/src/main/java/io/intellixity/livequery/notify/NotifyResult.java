package io.intellixity.livequery.notify;

/**
 * Outcome of one live-feed mutation.
 *
 * @param matched queries whose predicate accepts the change
 * @param driftedOut queries on the same table that no longer accept the entity
 * @param delivered pushes handed to the transport
 */
public record NotifyResult(int matched, int driftedOut, int delivered) {
  public static final NotifyResult NONE = new NotifyResult(0, 0, 0);
}
