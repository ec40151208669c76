package com.coderco.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * 요청별 traceId를 MDC에 설정하고 요청 한 건당 한 줄의 접근 로그를 남기는 필터
 *
 * 동작:
 * 1. X-Request-ID 헤더가 있으면 → 해당 값 사용
 * 2. 없으면 → 새로 생성 (REQ-XXXXXXXX)
 * 3. 응답 헤더에 같은 값 설정
 * 4. 처리 완료 후 method, uri, status, 소요 시간 로그
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String MDC_TRACE_ID = "traceId";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long startedAt = System.nanoTime();
        try {
            String traceId = request.getHeader(REQUEST_ID_HEADER);
            if (traceId == null || traceId.isBlank()) {
                traceId = generateTraceId();
            }
            MDC.put(MDC_TRACE_ID, traceId);
            response.setHeader(REQUEST_ID_HEADER, traceId);

            filterChain.doFilter(request, response);
        } finally {
            long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000;
            log.info("{} {} -> {} ({}ms)",
                    request.getMethod(), request.getRequestURI(), response.getStatus(), elapsedMs);
            // 워커 스레드 재사용 시 이전 요청 값이 남지 않도록 정리
            MDC.clear();
        }
    }

    static String generateTraceId() {
        return "REQ-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
