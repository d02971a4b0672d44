package com.flamingo.ai.embellisher.security;

import com.flamingo.ai.embellisher.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Requires a valid {@code Authorization: Bearer} header and exposes the caller as a request
 * attribute. Failures surface as {@link UnauthorizedException} and are rendered by the global
 * exception handler.
 */
@Component
@RequiredArgsConstructor
public class BearerTokenInterceptor implements HandlerInterceptor {

  public static final String USER_ATTRIBUTE = "embellisher.authenticatedUser";

  private static final String BEARER_PREFIX = "Bearer ";

  private final IdentityVerifier identityVerifier;

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
      return true;
    }
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null
        || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      throw new UnauthorizedException("Missing bearer token");
    }
    AuthenticatedUser user =
        identityVerifier.verify(header.substring(BEARER_PREFIX.length()).trim());
    request.setAttribute(USER_ATTRIBUTE, user);
    return true;
  }
}
