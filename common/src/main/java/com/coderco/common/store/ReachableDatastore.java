package com.coderco.common.store;

/**
 * 데이터스토어 연결 상태 확인 추상화
 *
 * <p>StartupGate는 이 인터페이스만 보고 기동 대기 여부를 판단합니다.</p>
 */
public interface ReachableDatastore {

    /**
     * 로그와 오류 응답에 쓰이는 백엔드 이름 (예: redis, mysql)
     */
    String backendName();

    /**
     * 백엔드가 요청을 받을 수 있는지 확인
     *
     * @throws com.coderco.common.exception.BackendUnavailableException 연결 불가 시
     */
    void ping();
}
