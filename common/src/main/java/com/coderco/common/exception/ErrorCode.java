package com.coderco.common.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {
    // ========================================
    // 공통
    // ========================================
    INTERNAL_ERROR("COMMON_001", "Internal server error"),
    UNSUPPORTED_REQUEST("COMMON_002", "No handler for this request"),

    // ========================================
    // 인프라/데이터스토어
    // ========================================
    /** 요청 처리 중 백엔드 호출 실패 (연결 거부, 인증 실패, 타임아웃) */
    BACKEND_UNAVAILABLE("INFRA_001", "Backend datastore is unavailable. Please try again later."),

    /** 기동 시 의존 데이터스토어에 끝내 연결하지 못함 */
    DEPENDENCY_UNREACHABLE("INFRA_002", "Dependency could not be reached during startup."),
    ;

    private final String code;
    private final String message;
}
