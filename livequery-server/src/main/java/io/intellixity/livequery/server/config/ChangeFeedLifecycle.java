package io.intellixity.livequery.server.config;

import io.intellixity.livequery.notify.ChangeNotifier;
import io.intellixity.livequery.notify.ChangeObserver;
import io.intellixity.livequery.store.ChangeFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/** Subscribes the notifier to the store's live feed for as long as the application runs. */
public final class ChangeFeedLifecycle implements SmartLifecycle {
  private static final Logger log = LoggerFactory.getLogger(ChangeFeedLifecycle.class);

  private final ChangeFeed feed;
  private final ChangeNotifier notifier;
  private volatile ChangeFeed.Subscription subscription;

  public ChangeFeedLifecycle(ChangeFeed feed, ChangeNotifier notifier) {
    this.feed = Objects.requireNonNull(feed, "feed");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
  }

  @Override
  public synchronized void start() {
    if (subscription != null) return;
    subscription = feed.subscribe(new ChangeObserver(notifier));
    log.info("Live feed subscribed");
  }

  @Override
  public synchronized void stop() {
    if (subscription == null) return;
    subscription.close();
    subscription = null;
    log.info("Live feed closed");
  }

  @Override
  public boolean isRunning() { return subscription != null; }
}
