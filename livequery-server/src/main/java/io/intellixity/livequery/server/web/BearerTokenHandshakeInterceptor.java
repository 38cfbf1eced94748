package io.intellixity.livequery.server.web;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * Extracts the bearer token of a WebSocket handshake into the session attributes. Browsers cannot set
 * headers on a WebSocket handshake, so an {@code access_token} query parameter is accepted as well.
 */
public final class BearerTokenHandshakeInterceptor implements HandshakeInterceptor {
  public static final String TOKEN_ATTRIBUTE = "livequery.token";
  public static final String TOKEN_PARAMETER = "access_token";
  private static final String BEARER = "Bearer ";

  private final boolean requireToken;

  public BearerTokenHandshakeInterceptor(boolean requireToken) {
    this.requireToken = requireToken;
  }

  @Override
  public boolean beforeHandshake(ServerHttpRequest request,
                                 ServerHttpResponse response,
                                 WebSocketHandler wsHandler,
                                 Map<String, Object> attributes) {
    String token = resolveToken(request.getHeaders(), request.getURI());
    if (token == null) {
      if (!requireToken) return true;
      response.setStatusCode(HttpStatus.UNAUTHORIZED);
      return false;
    }
    attributes.put(TOKEN_ATTRIBUTE, token);
    return true;
  }

  @Override
  public void afterHandshake(ServerHttpRequest request,
                             ServerHttpResponse response,
                             WebSocketHandler wsHandler,
                             Exception exception) {
  }

  static String resolveToken(HttpHeaders headers, URI uri) {
    String auth = headers.getFirst(HttpHeaders.AUTHORIZATION);
    if (auth != null && auth.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
      String t = auth.substring(BEARER.length()).trim();
      return t.isEmpty() ? null : t;
    }
    if (uri == null) return null;
    String t = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(TOKEN_PARAMETER);
    return t == null || t.isBlank() ? null : t.trim();
  }
}
