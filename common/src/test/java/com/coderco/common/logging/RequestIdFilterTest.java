package com.coderco.common.logging;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    @DisplayName("X-Request-ID 헤더가 있으면 그대로 MDC와 응답 헤더에 사용한다")
    void propagatesIncomingRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/count");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "REQ-ABCD1234");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenTraceId = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seenTraceId.set(MDC.get(RequestIdFilter.MDC_TRACE_ID));
            }
        });

        assertThat(seenTraceId.get()).isEqualTo("REQ-ABCD1234");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("REQ-ABCD1234");
        assertThat(MDC.get(RequestIdFilter.MDC_TRACE_ID)).isNull();
    }

    @Test
    @DisplayName("헤더가 없으면 REQ- 접두사의 traceId를 생성한다")
    void generatesRequestIdWhenMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).matches("REQ-[0-9A-F]{8}");
    }
}
