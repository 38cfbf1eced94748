package io.intellixity.livequery.client;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.WebSocketHttpHeaders;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionProviderTest {

  @Test
  void withoutTokenProvider_noAuthorizationHeader() {
    WebSocketHttpHeaders headers = ConnectionProvider.handshakeHeaders(null);
    assertNull(headers.getFirst(HttpHeaders.AUTHORIZATION));
  }

  @Test
  void missingToken_noAuthorizationHeader() {
    assertNull(ConnectionProvider.handshakeHeaders(() -> null).getFirst(HttpHeaders.AUTHORIZATION));
    assertNull(ConnectionProvider.handshakeHeaders(() -> "  ").getFirst(HttpHeaders.AUTHORIZATION));
  }

  @Test
  void tokenIsFetchedPerAttempt() {
    AtomicInteger calls = new AtomicInteger();
    TokenProvider tokens = () -> "t" + calls.incrementAndGet();

    assertEquals("Bearer t1", ConnectionProvider.handshakeHeaders(tokens).getFirst(HttpHeaders.AUTHORIZATION));
    assertEquals("Bearer t2", ConnectionProvider.handshakeHeaders(tokens).getFirst(HttpHeaders.AUTHORIZATION));
  }

  @Test
  void options_defaultRetryDelayIsOneSecond() {
    DatabaseOptions options = DatabaseOptions.of("ws://localhost:5000/hub");
    assertEquals(URI.create("ws://localhost:5000/hub"), options.url());
    assertEquals(Duration.ofSeconds(1), options.retryDelay());
    assertNull(options.tokenProvider());

    DatabaseOptions tuned = options.withRetryDelay(Duration.ofMillis(250)).withTokenProvider(() -> "x");
    assertEquals(Duration.ofMillis(250), tuned.retryDelay());
    assertEquals("x", tuned.tokenProvider().token());
  }

  @Test
  void options_rejectNegativeDelay() {
    assertThrows(IllegalArgumentException.class,
        () -> DatabaseOptions.of("ws://localhost/hub").withRetryDelay(Duration.ofMillis(-1)));
  }
}
