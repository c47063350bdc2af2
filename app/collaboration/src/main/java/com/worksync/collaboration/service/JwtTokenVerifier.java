/*
 * Where: collaboration identity
 * What: verifies HS256 bearer tokens issued by the product's auth service
 * Why: subject is the user id, the email and name claims feed presence payloads
 */
package com.worksync.collaboration.service;

import com.worksync.collaboration.config.IdentityProperties;
import com.worksync.collaboration.model.UserIdentity;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Component;

@Component
public class JwtTokenVerifier implements TokenVerifier {

  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_NAME = "name";

  private final JwtParser parser;

  public JwtTokenVerifier(IdentityProperties properties, Clock clock) {
    final SecretKey key = Keys.hmacShaKeyFor(properties.jwtSecret().getBytes(StandardCharsets.UTF_8));
    JwtParserBuilder builder = Jwts.parser().verifyWith(key).clock(() -> Date.from(clock.instant()));
    if (properties.hasIssuer()) {
      builder = builder.requireIssuer(properties.issuer());
    }
    this.parser = builder.build();
  }

  @Override
  public UserIdentity verify(String token) {
    final Claims claims;
    try {
      claims = parser.parseSignedClaims(token).getPayload();
    } catch (ExpiredJwtException ex) {
      throw new AuthenticationFailedException(
          AuthenticationFailedException.Reason.EXPIRED_TOKEN, "token expired", ex);
    } catch (JwtException | IllegalArgumentException ex) {
      throw new AuthenticationFailedException(
          AuthenticationFailedException.Reason.INVALID_TOKEN, "token rejected", ex);
    }
    final String subject = claims.getSubject();
    if (subject == null || subject.isBlank()) {
      throw new AuthenticationFailedException(
          AuthenticationFailedException.Reason.INVALID_TOKEN, "token has no subject");
    }
    return UserIdentity.of(
        subject, claims.get(CLAIM_EMAIL, String.class), claims.get(CLAIM_NAME, String.class));
  }
}
