package com.flamingo.ai.embellisher.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.embellisher.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
class BearerTokenInterceptorTest {

  @Mock private IdentityVerifier identityVerifier;

  @InjectMocks private BearerTokenInterceptor interceptor;

  private final MockHttpServletResponse response = new MockHttpServletResponse();

  @Test
  void shouldExposeVerifiedUser_whenBearerHeaderPresent() {
    // Given
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/notes");
    request.addHeader("Authorization", "bearer  token-1 ");
    AuthenticatedUser user = new AuthenticatedUser("user-1", null);
    when(identityVerifier.verify("token-1")).thenReturn(user);

    // When
    boolean proceed = interceptor.preHandle(request, response, new Object());

    // Then
    assertThat(proceed).isTrue();
    assertThat(request.getAttribute(BearerTokenInterceptor.USER_ATTRIBUTE)).isEqualTo(user);
  }

  @Test
  void shouldReject_whenHeaderMissingOrNotBearer() {
    MockHttpServletRequest missing = new MockHttpServletRequest("GET", "/api/notes");
    MockHttpServletRequest basic = new MockHttpServletRequest("GET", "/api/notes");
    basic.addHeader("Authorization", "Basic dXNlcjpwYXNz");

    assertThatThrownBy(() -> interceptor.preHandle(missing, response, new Object()))
        .isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> interceptor.preHandle(basic, response, new Object()))
        .isInstanceOf(UnauthorizedException.class);
    verify(identityVerifier, never()).verify(anyString());
  }

  @Test
  void shouldLetPreflightThrough() {
    MockHttpServletRequest preflight = new MockHttpServletRequest("OPTIONS", "/api/notes");

    assertThat(interceptor.preHandle(preflight, response, new Object())).isTrue();
  }
}
