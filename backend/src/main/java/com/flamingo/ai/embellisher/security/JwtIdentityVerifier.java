package com.flamingo.ai.embellisher.security;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import javax.crypto.SecretKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Verifies HMAC-signed JWTs; the subject claim is the user id. */
@Component
@Slf4j
public class JwtIdentityVerifier implements IdentityVerifier {

  private final SecretKey key;

  public JwtIdentityVerifier(EmbellisherProperties properties) {
    String secret = properties.getSecurity().getJwtSecret();
    if (secret == null || secret.isBlank()) {
      throw new IllegalStateException(
          "JWT secret is required. Set EMBELLISHER_JWT_SECRET environment variable.");
    }
    this.key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(secret));
  }

  @Override
  public AuthenticatedUser verify(String token) {
    if (token == null || token.isBlank()) {
      throw new UnauthorizedException("Missing bearer token");
    }
    try {
      Claims claims = Jwts.parser().verifyWith(key).build().parseSignedClaims(token).getPayload();
      String subject = claims.getSubject();
      if (subject == null || subject.isBlank()) {
        throw new UnauthorizedException("Token has no subject");
      }
      return new AuthenticatedUser(subject, claims.get("email", String.class));
    } catch (ExpiredJwtException e) {
      throw new UnauthorizedException("Token expired", e);
    } catch (JwtException | IllegalArgumentException e) {
      log.debug("Rejected bearer token: {}", e.getMessage());
      throw new UnauthorizedException("Invalid token", e);
    }
  }
}
