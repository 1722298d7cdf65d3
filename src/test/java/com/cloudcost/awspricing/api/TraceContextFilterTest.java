package com.cloudcost.awspricing.api;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceContextFilterTest {

    private final TraceContextFilter filter = new TraceContextFilter();

    @Test
    @DisplayName("Should reuse the caller's trace id and clear it afterwards")
    void shouldReuseTraceId() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/info");
        request.addHeader(TraceContext.HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        // When
        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req,
                                   HttpServletResponse res) {
                seen.set(TraceContext.getTraceIdOrNull());
            }
        }));

        // Then
        assertThat(seen.get()).isEqualTo("abc-123");
        assertThat(response.getHeader(TraceContext.HEADER)).isEqualTo("abc-123");
        assertThat(MDC.get(TraceContext.MDC_KEY)).isNull();
    }

    @Test
    @DisplayName("Should generate a trace id when none is sent")
    void shouldGenerateTraceId() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("POST", "/api/v1/costs/projected"), response, new MockFilterChain());

        assertThat(response.getHeader(TraceContext.HEADER)).isNotBlank().hasSize(36);
        assertThat(TraceContext.getTraceIdOrNull()).isNull();
    }
}
