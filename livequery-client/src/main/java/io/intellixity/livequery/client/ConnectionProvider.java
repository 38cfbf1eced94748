package io.intellixity.livequery.client;

import io.intellixity.livequery.protocol.HubMessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.util.Objects;

/** Builds hub connections for a set of {@link DatabaseOptions}. */
public final class ConnectionProvider {
  private static final Logger log = LoggerFactory.getLogger(ConnectionProvider.class);

  private final HubMessageCodec codec;

  public ConnectionProvider() {
    this(new HubMessageCodec());
  }

  public ConnectionProvider(HubMessageCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public HubConnection create(DatabaseOptions options) {
    return new WebSocketHubConnection(new StandardWebSocketClient(), options, codec);
  }

  /**
   * Handshake headers for one connect attempt. The token is fetched anew on every call; without a
   * provider, or when it yields no token, no Authorization header is sent at all.
   */
  public static WebSocketHttpHeaders handshakeHeaders(TokenProvider tokenProvider) {
    WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
    if (tokenProvider == null) return headers;
    String token = tokenProvider.token();
    if (token == null || token.isBlank()) {
      log.warn("Token provider returned no token, connecting without Authorization");
      return headers;
    }
    headers.add(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    return headers;
  }
}
