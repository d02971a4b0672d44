package com.flamingo.ai.embellisher.security;

import com.flamingo.ai.embellisher.exception.UnauthorizedException;

/** Verifies bearer credentials issued by the external identity provider. */
public interface IdentityVerifier {

  /**
   * Verifies a raw bearer token.
   *
   * @param token the token without the {@code Bearer } prefix
   * @return the verified caller
   * @throws UnauthorizedException if the token is malformed, forged or expired
   */
  AuthenticatedUser verify(String token);
}
