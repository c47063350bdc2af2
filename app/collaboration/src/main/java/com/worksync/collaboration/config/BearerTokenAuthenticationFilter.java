package com.worksync.collaboration.config;

import com.worksync.collaboration.model.UserIdentity;
import com.worksync.collaboration.service.AuthenticationFailedException;
import com.worksync.collaboration.service.IdentityResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates {@code Authorization: Bearer} requests through the identity resolver. Requests
 * without the header pass through unauthenticated and are rejected later by the authorization
 * rules; a header that fails verification is answered with 401 right away.
 */
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
  private static final String USER_ROLE = "ROLE_USER";

  private final IdentityResolver identityResolver;

  public BearerTokenAuthenticationFilter(IdentityResolver identityResolver) {
    this.identityResolver = identityResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || header.isBlank()) {
      filterChain.doFilter(request, response);
      return;
    }
    final UserIdentity identity;
    try {
      identity = identityResolver.resolveAuthorizationHeader(header);
    } catch (AuthenticationFailedException ex) {
      logger.info("bearer authentication failed reason={} path={}", ex.reason(), request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
      return;
    }
    final UsernamePasswordAuthenticationToken authentication =
        new UsernamePasswordAuthenticationToken(
            identity.userId(), "N/A", List.of(new SimpleGrantedAuthority(USER_ROLE)));
    authentication.setDetails(identity);
    SecurityContextHolder.getContext().setAuthentication(authentication);
    filterChain.doFilter(request, response);
  }
}
