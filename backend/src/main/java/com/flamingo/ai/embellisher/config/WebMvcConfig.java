package com.flamingo.ai.embellisher.config;

import com.flamingo.ai.embellisher.security.BearerTokenInterceptor;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration: authentication guard, CORS and exported artifact serving. */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  /** OAuth redirect target; the browser arrives here without our bearer token. */
  static final String DRIVE_CALLBACK_PATH = "/api/drive/callback";

  private final BearerTokenInterceptor bearerTokenInterceptor;
  private final EmbellisherProperties properties;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry
        .addInterceptor(bearerTokenInterceptor)
        .addPathPatterns("/api/**")
        .excludePathPatterns(DRIVE_CALLBACK_PATH);
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/api/**")
        .allowedOrigins(properties.getSecurity().getAllowedOrigins().toArray(String[]::new))
        .allowedMethods("GET", "POST", "PATCH", "DELETE", "OPTIONS")
        .allowedHeaders("*");
  }

  /** Serves stored artifacts read-only under the public path. */
  @Override
  public void addResourceHandlers(ResourceHandlerRegistry registry) {
    String location =
        Path.of(properties.getExport().getStorageDir())
            .toAbsolutePath()
            .normalize()
            .toUri()
            .toString();
    registry
        .addResourceHandler(properties.getExport().getPublicPath() + "/**")
        .addResourceLocations(location.endsWith("/") ? location : location + "/");
  }
}
