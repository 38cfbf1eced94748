package io.intellixity.livequery.store;

import io.intellixity.livequery.change.StoreMutation;

import java.util.function.Consumer;

/** Live, ordered feed of store mutations. */
public interface ChangeFeed {
  /**
   * Starts delivering mutations to the observer, one at a time and in store order.
   *
   * @return handle that stops the delivery when closed
   */
  Subscription subscribe(Consumer<StoreMutation> observer);

  interface Subscription extends AutoCloseable {
    @Override
    void close();
  }
}
