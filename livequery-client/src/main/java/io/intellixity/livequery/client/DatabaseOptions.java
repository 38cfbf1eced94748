package io.intellixity.livequery.client;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Client connection settings.
 *
 * @param url hub endpoint, e.g. {@code ws://localhost:5000/hub}
 * @param tokenProvider optional; without one no Authorization header is sent
 * @param retryDelay pause between reconnect attempts
 */
public record DatabaseOptions(URI url, TokenProvider tokenProvider, Duration retryDelay) {
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

  public DatabaseOptions {
    Objects.requireNonNull(url, "url");
    retryDelay = retryDelay == null ? DEFAULT_RETRY_DELAY : retryDelay;
    if (retryDelay.isNegative()) throw new IllegalArgumentException("retryDelay must not be negative");
  }

  public static DatabaseOptions of(String url) {
    return new DatabaseOptions(URI.create(url), null, null);
  }

  public DatabaseOptions withTokenProvider(TokenProvider tokenProvider) {
    return new DatabaseOptions(url, tokenProvider, retryDelay);
  }

  public DatabaseOptions withRetryDelay(Duration retryDelay) {
    return new DatabaseOptions(url, tokenProvider, retryDelay);
  }
}
