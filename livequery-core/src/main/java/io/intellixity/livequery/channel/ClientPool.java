package io.intellixity.livequery.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Best-effort delivery of one notification to one connection.
 * <p>
 * Failures never reach the caller: a vanished connection or a failed send is logged and the returned
 * future completes with {@code false}. A client that missed a push is resynchronized when it
 * re-registers its queries after reconnecting.
 */
public final class ClientPool {
  private static final Logger log = LoggerFactory.getLogger(ClientPool.class);

  private final Channel channel;

  public ClientPool(Channel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  /** @return a future completing with true once the payload was handed to the transport */
  public CompletableFuture<Boolean> invoke(String method, String connectionId, String queryName, Object payload) {
    CompletableFuture<Void> sent;
    try {
      sent = channel.invoke(connectionId, method, queryName, payload);
    } catch (RuntimeException e) {
      sent = CompletableFuture.failedFuture(e);
    }
    return sent.handle((ok, err) -> {
      if (err == null) return true;
      Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
      if (cause instanceof ConnectionNotFoundException) {
        log.warn("Dropping {} for query '{}': connection {} is gone", method, queryName, connectionId);
      } else {
        log.error("Failed to send {} for query '{}' to connection {}", method, queryName, connectionId, cause);
      }
      return false;
    });
  }
}
