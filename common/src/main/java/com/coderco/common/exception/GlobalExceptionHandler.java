package com.coderco.common.exception;

import com.coderco.common.dto.ErrorResponse;
import com.coderco.common.logging.RequestIdFilter;
import com.coderco.common.startup.ServiceLifecycle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 전역 예외 처리기
 *
 * <h2>예외 분류</h2>
 * <pre>
 * - BackendUnavailableException: 백엔드 일시 장애 (503 Service Unavailable)
 * - Spring MVC 클라이언트 오류 (404, 405, 406 등): 원래 상태 코드 유지
 * - 기타 Exception: 시스템 오류 (500 Internal Server Error)
 * </pre>
 *
 * <h2>Content-Type 고정</h2>
 * <p>성공 응답은 text/plain이지만 오류 본문은 항상 application/json으로 고정합니다.
 * Content-Type이 미리 지정되면 Accept 헤더와 무관하게 기록되므로
 * {@code Accept: text/plain} 요청도 503을 그대로 받습니다.</p>
 *
 * <p>READY 상태에서 어떤 예외도 프로세스를 종료시키지 않도록 모든 예외를 HTTP 응답으로 변환합니다.</p>
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final ServiceLifecycle serviceLifecycle;

    /**
     * 백엔드 장애 처리 (503 Service Unavailable)
     * <p>
     * 클라이언트는 이 응답을 받으면 잠시 후 재시도할 수 있습니다.
     */
    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleBackendUnavailable(BackendUnavailableException e) {
        log.warn("백엔드 장애: backend={}, state={}, message={}",
                e.getBackend(), serviceLifecycle.getState(), e.getMessage());

        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode(), e.getBackend());
    }

    /**
     * Spring MVC 클라이언트 오류 (404 Not Found, 405 Method Not Allowed, 406 Not Acceptable 등)
     * <p>
     * 예외가 가진 상태 코드를 그대로 사용합니다.
     */
    public ResponseEntity<ErrorResponse> handleUnsupportedRequest(org.springframework.web.ErrorResponse e) {
        HttpStatusCode status = e.getStatusCode();
        log.debug("지원하지 않는 요청: status={}, type={}", status.value(), e.getClass().getSimpleName());

        return respond(status, ErrorCode.UNSUPPORTED_REQUEST, null);
    }

    /**
     * 기타 모든 예외 처리 (500 Internal Server Error)
     * <p>
     * Spring의 ErrorResponse 구현체(NoResourceFoundException, HttpMediaTypeNotAcceptableException 등)는
     * 클라이언트 오류로 분기합니다.
     * <p>
     * 주의: 예외 메시지를 클라이언트에 노출하지 않고 일반적인 에러 메시지를 반환합니다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        if (e instanceof org.springframework.web.ErrorResponse webError) {
            return handleUnsupportedRequest(webError);
        }

        log.error("예외 발생: ", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR, null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatusCode status, ErrorCode errorCode, String backend) {
        return ResponseEntity
                .status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of(errorCode, backend, MDC.get(RequestIdFilter.MDC_TRACE_ID)));
    }
}
