package io.intellixity.livequery.notify;

import io.intellixity.livequery.change.StoreMutation;
import io.intellixity.livequery.query.Query;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

final class ChangeObserverTest {

  static final class FailingNotifier implements ChangeNotifier {
    final List<StoreMutation> seen = new ArrayList<>();

    @Override
    public CompletableFuture<Boolean> notifyFullResults(Query query) {
      throw new UnsupportedOperationException();
    }

    @Override
    public CompletableFuture<NotifyResult> notifyEntityChanged(StoreMutation mutation) {
      seen.add(mutation);
      if (mutation.id().equals("sync")) throw new IllegalStateException("boom");
      return CompletableFuture.failedFuture(new IllegalStateException("async boom"));
    }
  }

  @Test
  void failuresAreLoggedAndTheFeedContinues() {
    FailingNotifier notifier = new FailingNotifier();
    ChangeObserver observer = new ChangeObserver(notifier);

    assertDoesNotThrow(() -> observer.accept(StoreMutation.put("Users", "sync")));
    assertDoesNotThrow(() -> observer.accept(StoreMutation.put("Users", "async")));
    assertEquals(2, notifier.seen.size());
  }
}
