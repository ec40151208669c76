package com.coderco.common.dto;

import com.coderco.common.exception.ErrorCode;

/**
 * 오류 응답 본문
 *
 * @param code    에러 코드 (예: INFRA_001)
 * @param message 사용자에게 노출되는 메시지
 * @param backend 실패한 백엔드 이름 (없으면 null)
 * @param traceId 요청 추적 ID (로그와 대조용)
 */
public record ErrorResponse(
        String code,
        String message,
        String backend,
        String traceId
) {
    public static ErrorResponse of(ErrorCode errorCode, String backend, String traceId) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage(), backend, traceId);
    }
}
