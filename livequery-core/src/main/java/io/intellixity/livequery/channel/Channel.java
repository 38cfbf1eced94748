package io.intellixity.livequery.channel;

import java.util.concurrent.CompletableFuture;

/** Per-connection push transport. */
public interface Channel {

  /**
   * Invokes {@code method} on the client behind {@code connectionId}.
   * <p>
   * The returned future fails with {@link ConnectionNotFoundException} when the connection is gone, or
   * with the transport's own exception when the send fails.
   */
  CompletableFuture<Void> invoke(String connectionId, String method, Object... arguments);
}
