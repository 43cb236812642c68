package com.promptsmith.optimizer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

  @Value("${cors.allowed-origins:}")
  private String[] allowedOrigins;

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", "/swagger-ui/index.html");
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    // the prompt editor reads the log filename and the correlation id from responses
    registry
        .addMapping("/api/**")
        .allowedOriginPatterns(
            allowedOrigins == null || allowedOrigins.length == 0
                ? new String[] {"*"}
                : allowedOrigins)
        .allowedMethods("GET", "POST", "PUT", "DELETE")
        .allowedHeaders("*")
        .exposedHeaders(HttpHeaders.CONTENT_DISPOSITION, CORRELATION_ID_HEADER);
  }
}
