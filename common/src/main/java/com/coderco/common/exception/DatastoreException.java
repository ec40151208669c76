package com.coderco.common.exception;

import lombok.Getter;

/**
 * 데이터스토어 관련 예외의 공통 부모
 *
 * <p>어떤 백엔드(redis, mysql)에서 발생했는지와 {@link ErrorCode}를 함께 보관합니다.</p>
 */
@Getter
public abstract class DatastoreException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String backend;

    protected DatastoreException(ErrorCode errorCode, String backend, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.backend = backend;
    }
}
