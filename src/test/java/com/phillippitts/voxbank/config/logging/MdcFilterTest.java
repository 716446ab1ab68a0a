package com.phillippitts.voxbank.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    private Map<String, String> captureContext() throws IOException, ServletException {
        Map<String, String> seen = new HashMap<>();
        doAnswer(invocation -> {
            seen.putAll(ThreadContext.getImmutableContext());
            return null;
        }).when(chain).doFilter(any(), any());
        filter.doFilter(request, response, chain);
        return seen;
    }

    @Test
    void putsRequestIdScopeAndRouteDuringTheRequest() throws Exception {
        when(request.getHeader("X-Request-ID")).thenReturn("req-42");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/vox/guild-1/synthesize");

        Map<String, String> seen = captureContext();

        assertThat(seen)
                .containsEntry("requestId", "req-42")
                .containsEntry("scopeId", "guild-1")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/vox/guild-1/synthesize");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void generatesARequestIdWhenTheHeaderIsMissing() throws Exception {
        when(request.getHeader("X-Request-ID")).thenReturn(" ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/actuator/health");

        Map<String, String> seen = captureContext();

        assertThat(seen.get("requestId"))
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
        assertThat(seen).doesNotContainKey("scopeId");
    }

    @Test
    void clearsTheContextWhenTheChainFails() throws Exception {
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/vox/g/stats");
        doThrow(new ServletException("boom")).when(chain).doFilter(any(), any());

        assertThatThrownBy(() -> filter.doFilter(request, response, chain)).isInstanceOf(ServletException.class);
        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("scopeId")).isNull();
    }

    @Test
    void scopeIsTakenFromVoxRoutesOnly() {
        assertThat(MdcFilter.scopeOf("/api/vox/abc")).isEqualTo("abc");
        assertThat(MdcFilter.scopeOf("/api/vox/abc/clips")).isEqualTo("abc");
        assertThat(MdcFilter.scopeOf("/api/vox/a b/clips")).isNull();
        assertThat(MdcFilter.scopeOf("/api/other/abc")).isNull();
        assertThat(MdcFilter.scopeOf(null)).isNull();
    }
}
