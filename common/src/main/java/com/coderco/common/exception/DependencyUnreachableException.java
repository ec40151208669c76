package com.coderco.common.exception;

import lombok.Getter;

/**
 * 기동 단계에서 최대 시도 횟수를 모두 소진한 경우 발생 (치명적)
 *
 * <p>빈 생성 중에 던져지므로 컨텍스트 refresh가 실패하고 서비스는 READY로 전환되지 않습니다.</p>
 */
@Getter
public class DependencyUnreachableException extends DatastoreException {

    private final int attempts;

    public DependencyUnreachableException(String dependency, int attempts, Throwable cause) {
        super(ErrorCode.DEPENDENCY_UNREACHABLE, dependency,
                "Dependency '" + dependency + "' unreachable after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }
}
