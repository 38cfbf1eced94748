package io.intellixity.livequery.notify;

import io.intellixity.livequery.change.StoreMutation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Live-feed callback feeding the notifier.
 * <p>
 * Each mutation is processed to completion before {@link #accept} returns, keeping pushes in feed order.
 * Failures are logged and discarded; the feed keeps running.
 */
public final class ChangeObserver implements Consumer<StoreMutation> {
  private static final Logger log = LoggerFactory.getLogger(ChangeObserver.class);

  private final ChangeNotifier notifier;

  public ChangeObserver(ChangeNotifier notifier) {
    this.notifier = Objects.requireNonNull(notifier, "notifier");
  }

  @Override
  public void accept(StoreMutation mutation) {
    try {
      NotifyResult result = notifier.notifyEntityChanged(mutation).join();
      if (result.matched() + result.driftedOut() > 0) {
        log.debug("{}/{} notified {} queries", mutation.collection(), mutation.id(), result.delivered());
      }
    } catch (CompletionException e) {
      log.error("Failed to process mutation {}", mutation, e.getCause() == null ? e : e.getCause());
    } catch (RuntimeException e) {
      log.error("Failed to process mutation {}", mutation, e);
    }
  }
}
