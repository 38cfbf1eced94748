package io.intellixity.livequery.notify;

import io.intellixity.livequery.change.StoreMutation;
import io.intellixity.livequery.query.Query;

import java.util.concurrent.CompletableFuture;

/** Pushes query results and live changes to subscribed connections. */
public interface ChangeNotifier {

  /**
   * Pushes the complete current result of a freshly registered or modified query to its connection:
   * one {@code entityChanged} batch of upserts for a plain query, one {@code pageChanged} snapshot for a
   * paginated one.
   *
   * @return a future completing with true if the push reached the transport
   */
  CompletableFuture<Boolean> notifyFullResults(Query query);

  /** Runs one live-feed mutation through classification, matching and fan-out. */
  CompletableFuture<NotifyResult> notifyEntityChanged(StoreMutation mutation);
}
