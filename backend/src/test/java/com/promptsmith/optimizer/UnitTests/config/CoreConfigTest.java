package com.promptsmith.optimizer.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("CoreConfig Tests")
class CoreConfigTest {

  private final CoreConfig coreConfig = new CoreConfig();

  @Nested
  @DisplayName("ObjectMapper")
  class ObjectMapperTests {

    @Test
    @DisplayName("Should write instants as ISO text")
    void shouldWriteIsoDates() throws Exception {
      ObjectMapper mapper = coreConfig.objectMapper();

      String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2026-01-01T12:00:00Z")));

      assertThat(json).contains("\"2026-01-01T12:00:00Z\"");
    }

    @Test
    @DisplayName("Should ignore unknown properties")
    void shouldIgnoreUnknownProperties() throws Exception {
      ObjectMapper mapper = coreConfig.objectMapper();

      OptimizerProperties.Executor executor =
          mapper.readValue(
              "{\"corePoolSize\": 2, \"unexpected\": true}", OptimizerProperties.Executor.class);

      assertThat(executor.getCorePoolSize()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("Executors")
  class ExecutorTests {

    @Test
    @DisplayName("Should size the pass executor from the properties")
    void shouldSizePassExecutor() {
      OptimizerProperties properties = new OptimizerProperties();
      properties.getExecutor().setCorePoolSize(2);
      properties.getExecutor().setMaxPoolSize(3);

      ThreadPoolTaskExecutor executor = coreConfig.orchestrationExecutor(properties);
      try {
        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("optimizer-pass-");
      } finally {
        executor.shutdown();
      }
    }

    @Test
    @DisplayName("Should run time-limited calls on daemon threads")
    void shouldUseDaemonThreads() throws Exception {
      ExecutorService executor = coreConfig.timeLimitedCallExecutor();
      try {
        Future<Boolean> daemon = executor.submit(() -> Thread.currentThread().isDaemon());

        assertThat(daemon.get(5, TimeUnit.SECONDS)).isTrue();
      } finally {
        executor.shutdownNow();
      }
    }
  }
}
