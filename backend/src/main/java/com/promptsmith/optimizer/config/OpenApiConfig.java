package com.promptsmith.optimizer.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;

/** API description shown by Swagger UI; tags are listed in the order a client uses them. */
@Configuration
public class OpenApiConfig {

  @Value("${springdoc.info.title:PromptSmith Optimizer API}")
  private String title;

  @Value("${springdoc.info.version:0.1.0}")
  private String version;

  @Value("${springdoc.info.description:Optimizes instruction prompts from task requests}")
  private String description;

  @Bean
  public OpenAPI promptSmithOpenAPI() {
    return new OpenAPI()
        .info(new Info().title(title).version(version).description(description))
        .tags(
            List.of(
                new Tag()
                    .name("Optimization")
                    .description("Start a session or refine its prompt from feedback"),
                new Tag().name("Feedback").description("Comments anchored to prompt spans"),
                new Tag()
                    .name("Sessions")
                    .description(
                        "Inspect, edit and discard sessions; pass X-Correlation-Id to trace a"
                            + " request in the logs")));
  }
}
