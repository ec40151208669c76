package com.coderco.common.startup;

/**
 * 서비스 생명주기 상태
 * <p>
 * 상태 전이:
 * STARTING → READY
 * <p>
 * STARTING에서 의존 대상 연결 실패가 확정되면 프로세스는 READY에 도달하지 못하고 종료됩니다.
 */
public enum ServiceState {

    /**
     * StartupGate 재시도 중 - 트래픽 미수신
     */
    STARTING,

    /**
     * 요청 처리 중 - 프로세스 종료 시까지 유지
     */
    READY
}
