package com.flamingo.ai.embellisher.api.rest;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.embellisher.config.EmbellisherProperties;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import com.flamingo.ai.embellisher.exception.DriveNotConnectedException;
import com.flamingo.ai.embellisher.exception.DriveProviderException;
import com.flamingo.ai.embellisher.exception.GlobalExceptionHandler;
import com.flamingo.ai.embellisher.exception.UnauthorizedException;
import com.flamingo.ai.embellisher.service.drive.DriveBridgeService;
import com.flamingo.ai.embellisher.service.drive.DriveBridgeService.AuthorizationRequest;
import com.flamingo.ai.embellisher.service.drive.DriveBridgeService.DriveUploadResult;
import com.flamingo.ai.embellisher.service.drive.GoogleDriveClient.DriveFile;
import com.flamingo.ai.embellisher.security.AuthenticatedUser;
import com.flamingo.ai.embellisher.security.BearerTokenInterceptor;
import com.flamingo.ai.embellisher.security.IdentityVerifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DriveController")
class DriveControllerTest {

  private static final String OWNER = "user-1";
  private static final String REDIRECT = "https://app.example/drive-connected";

  @Mock private DriveBridgeService driveBridgeService;
  @Mock private IdentityVerifier identityVerifier;

  private MockMvc mockMvc;

  /** The callback is registered outside the bearer guard, so it is exercised without it. */
  private MockMvc callbackMvc;

  @BeforeEach
  void setUp() {
    EmbellisherProperties properties = new EmbellisherProperties();
    properties.getDrive().setSuccessRedirect(REDIRECT);
    DriveController controller = new DriveController(driveBridgeService, properties);
    GlobalExceptionHandler exceptionHandler = new GlobalExceptionHandler(new SimpleMeterRegistry());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(exceptionHandler)
            .addInterceptors(new BearerTokenInterceptor(identityVerifier))
            .build();
    callbackMvc =
        MockMvcBuilders.standaloneSetup(controller).setControllerAdvice(exceptionHandler).build();
    when(identityVerifier.verify("token")).thenReturn(new AuthenticatedUser(OWNER, null));
  }

  @Nested
  @DisplayName("OAuth callback")
  class Callback {

    @Test
    void shouldRedirectConnected_whenAuthorizationCompletes() throws Exception {
      when(driveBridgeService.completeAuthorization("state-1", "code-1")).thenReturn(OWNER);

      callbackMvc
          .perform(get("/api/drive/callback").param("state", "state-1").param("code", "code-1"))
          .andExpect(status().isFound())
          .andExpect(header().string("Location", REDIRECT + "?drive=connected"));
    }

    @Test
    void shouldRedirectDenied_whenUserDeclinedConsent() throws Exception {
      callbackMvc
          .perform(get("/api/drive/callback").param("error", "access_denied"))
          .andExpect(status().isFound())
          .andExpect(header().string("Location", REDIRECT + "?drive=denied"));
      verify(driveBridgeService, never()).completeAuthorization(anyString(), anyString());
    }

    @Test
    void shouldRedirectFailed_whenStateIsUnknown() throws Exception {
      when(driveBridgeService.completeAuthorization("forged", "code-1"))
          .thenThrow(new UnauthorizedException("Unknown authorization state"));

      callbackMvc
          .perform(get("/api/drive/callback").param("state", "forged").param("code", "code-1"))
          .andExpect(status().isFound())
          .andExpect(header().string("Location", REDIRECT + "?drive=failed"));
    }

    @Test
    void shouldRedirectFailed_whenCodeExchangeFails() throws Exception {
      when(driveBridgeService.completeAuthorization("state-1", "bad"))
          .thenThrow(new DriveProviderException("Authorization code exchange failed", 400));

      callbackMvc
          .perform(get("/api/drive/callback").param("state", "state-1").param("code", "bad"))
          .andExpect(header().string("Location", REDIRECT + "?drive=failed"));
    }
  }

  @Test
  void shouldReturnAuthorizationUrl() throws Exception {
    when(driveBridgeService.authorizationUrl(OWNER))
        .thenReturn(new AuthorizationRequest("https://accounts.example/auth?state=s1", "s1"));

    mockMvc
        .perform(get("/api/drive/auth-url").header("Authorization", "Bearer token"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.authUrl").value("https://accounts.example/auth?state=s1"))
        .andExpect(jsonPath("$.state").value("s1"));
  }

  @Test
  void shouldRequireToken_forStatus() throws Exception {
    mockMvc
        .perform(get("/api/drive/status"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("AUTH_001"));
  }

  @Test
  void shouldUploadPdfByDefault() throws Exception {
    UUID noteId = UUID.randomUUID();
    when(driveBridgeService.upload(OWNER, noteId, ExportFormat.PDF))
        .thenReturn(
            new DriveUploadResult(
                noteId,
                ExportFormat.PDF,
                new DriveFile("file-1", "notes.pdf", "https://drive.example/file-1", null)));

    mockMvc
        .perform(
            post("/api/notes/{noteId}/drive-upload", noteId)
                .header("Authorization", "Bearer token"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.fileId").value("file-1"))
        .andExpect(jsonPath("$.format").value("pdf"))
        .andExpect(jsonPath("$.webViewLink").value("https://drive.example/file-1"));
  }

  @Test
  void shouldReturn409WithDriveCode_whenNotConnected() throws Exception {
    UUID noteId = UUID.randomUUID();
    when(driveBridgeService.upload(OWNER, noteId, ExportFormat.TXT))
        .thenThrow(new DriveNotConnectedException(OWNER));

    mockMvc
        .perform(
            post("/api/notes/{noteId}/drive-upload", noteId)
                .param("format", "txt")
                .header("Authorization", "Bearer token"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("DRIVE_001"));
  }
}
