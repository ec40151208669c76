package com.coderco.common.exception;

/**
 * 요청 처리 중 백엔드 연산 실패
 *
 * <p>요청 단위로 복구됩니다. {@link GlobalExceptionHandler}가 503으로 변환하며 프로세스는 계속 동작합니다.</p>
 */
public class BackendUnavailableException extends DatastoreException {

    public BackendUnavailableException(String backend, String message, Throwable cause) {
        super(ErrorCode.BACKEND_UNAVAILABLE, backend, message, cause);
    }

    public BackendUnavailableException(String backend, String message) {
        this(backend, message, null);
    }
}
