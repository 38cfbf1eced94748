package io.intellixity.livequery.change;

/** Kind of a raw store mutation as reported by a live feed. */
public enum MutationKind {
  PUT,
  DELETE,
  /** Deletion replicated from another node as a tombstone. */
  TOMBSTONE_DELETE,
  /** Collection-level events (drop, rename, invalidation); never turned into a {@link Change}. */
  COLLECTION,
  UNKNOWN
}
