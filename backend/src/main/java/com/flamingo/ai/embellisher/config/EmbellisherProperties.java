package com.flamingo.ai.embellisher.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the note pipeline, exports and integrations. */
@Configuration
@ConfigurationProperties(prefix = "embellisher")
@Getter
@Setter
public class EmbellisherProperties {

  private Upload upload = new Upload();
  private Processing processing = new Processing();
  private Export export = new Export();
  private Compilation compilation = new Compilation();
  private Drive drive = new Drive();
  private Security security = new Security();

  @Getter
  @Setter
  public static class Upload {
    private int maxFiles = 5;
    private long maxFileSizeBytes = 10L * 1024 * 1024;
    private List<String> allowedMediaTypes =
        new ArrayList<>(List.of("image/png", "image/jpeg", "application/pdf"));
  }

  @Getter
  @Setter
  public static class Processing {
    /** Longest text handed to the enhancement model. */
    private int maxInputChars = 60_000;

    private float pdfRenderDpi = 150f;
    private int maxPdfPages = 10;
  }

  @Getter
  @Setter
  public static class Export {
    private String storageDir = "./data/artifacts";
    private String publicBaseUrl = "http://localhost:8080";
    private String publicPath = "/files";

    /** Use the model to convert Markdown to LaTeX; the local renderer is always the fallback. */
    private boolean aiLatexEnabled = true;
  }

  @Getter
  @Setter
  public static class Compilation {
    private Local local = new Local();
    private Remote remote = new Remote();

    @Getter
    @Setter
    public static class Local {
      private boolean enabled = true;
      private String command = "pdflatex";
      private int timeoutSeconds = 30;
      private int passes = 2;
    }

    @Getter
    @Setter
    public static class Remote {
      private boolean enabled = true;
      private String baseUrl = "https://latex.ytotech.com";
      private int timeoutSeconds = 120;

      /** Line terminator the remote service expects: CRLF or LF. */
      private String lineEnding = "CRLF";
    }
  }

  @Getter
  @Setter
  public static class Drive {
    private String clientId = "";
    private String clientSecret = "";
    private String redirectUri = "http://localhost:8080/api/drive/callback";
    private String successRedirect = "http://localhost:3000/drive-connected";
    private String folderId = "";
    private String authUri = "https://accounts.google.com/o/oauth2/auth";
    private String tokenUri = "https://oauth2.googleapis.com/token";
    private String apiBaseUrl = "https://www.googleapis.com";
    private String scope = "https://www.googleapis.com/auth/drive.file";
    private int stateTtlMinutes = 15;
  }

  @Getter
  @Setter
  public static class Security {
    /** Base64-encoded HMAC key shared with the identity provider. */
    private String jwtSecret = "";

    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
  }
}
