package com.promptsmith.optimizer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@DisplayName("RequestMdcFilter Tests")
class RequestMdcFilterTest {

  private final RequestMdcFilter filter = new RequestMdcFilter();

  private final AtomicReference<String> seenUser = new AtomicReference<>();
  private final AtomicReference<String> seenCorrelationId = new AtomicReference<>();

  private MockFilterChain recordingChain() {
    return new MockFilterChain(
        new HttpServlet() {
          @Override
          protected void service(HttpServletRequest req, HttpServletResponse resp) {
            seenUser.set(MDC.get(RequestMdcFilter.USERNAME_MDC_KEY));
            seenCorrelationId.set(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY));
          }
        });
  }

  @Test
  @DisplayName("Should put the username and correlation id in the MDC during the request")
  void shouldPopulateMdc() throws Exception {
    // Given
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/optimize");
    request.addHeader(RequestMdcFilter.USERNAME_HEADER, "alice");
    request.addHeader(RequestMdcFilter.CORRELATION_ID_HEADER, "corr-1");
    MockHttpServletResponse response = new MockHttpServletResponse();

    // When
    filter.doFilter(request, response, recordingChain());

    // Then
    assertThat(seenUser.get()).isEqualTo("alice");
    assertThat(seenCorrelationId.get()).isEqualTo("corr-1");
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER)).isEqualTo("corr-1");
    assertThat(MDC.get(RequestMdcFilter.USERNAME_MDC_KEY)).isNull();
    assertThat(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }

  @Test
  @DisplayName("Should fall back to anonymous and generate a correlation id")
  void shouldUseDefaults() throws Exception {
    // Given
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sessions");
    MockHttpServletResponse response = new MockHttpServletResponse();

    // When
    filter.doFilter(request, response, recordingChain());

    // Then
    assertThat(seenUser.get()).isEqualTo(RequestMdcFilter.DEFAULT_USERNAME);
    assertThat(seenCorrelationId.get()).isNotBlank();
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER))
        .isEqualTo(seenCorrelationId.get());
  }
}
