/*
 * Where: WebSocket transport
 * What: authenticates the upgrade request before any connection state exists
 * Why: a rejected handshake must never reach the registry
 */
package com.worksync.collaboration.ws;

import com.worksync.collaboration.model.UserIdentity;
import com.worksync.collaboration.service.AuthenticationFailedException;
import com.worksync.collaboration.service.IdentityResolver;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

@Component
@RequiredArgsConstructor
public class BearerTokenHandshakeInterceptor implements HandshakeInterceptor {

  public static final String IDENTITY_ATTRIBUTE = "collaboration.identity";
  static final String TOKEN_QUERY_PARAMETER = "token";

  private static final Logger logger = LoggerFactory.getLogger(BearerTokenHandshakeInterceptor.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final IdentityResolver identityResolver;

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    try {
      final UserIdentity identity = identityResolver.resolve(resolveToken(request));
      attributes.put(IDENTITY_ATTRIBUTE, identity);
      return true;
    } catch (AuthenticationFailedException ex) {
      logger.info(
          "websocket handshake rejected reason={} remote={}",
          ex.reason(),
          request.getRemoteAddress());
      response.setStatusCode(HttpStatus.UNAUTHORIZED);
      return false;
    }
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      @Nullable Exception exception) {
    // nothing to clean up
  }

  // Browsers cannot set headers on a WebSocket upgrade, so the query parameter is accepted too.
  private String resolveToken(ServerHttpRequest request) {
    final String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
    if (header != null && header.startsWith(BEARER_PREFIX)) {
      return header.substring(BEARER_PREFIX.length()).trim();
    }
    final String raw =
        UriComponentsBuilder.fromUri(request.getURI())
            .build()
            .getQueryParams()
            .getFirst(TOKEN_QUERY_PARAMETER);
    return raw == null ? null : UriUtils.decode(raw, StandardCharsets.UTF_8);
  }
}
