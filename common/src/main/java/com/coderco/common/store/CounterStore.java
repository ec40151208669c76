package com.coderco.common.store;

/**
 * 영속 카운터 저장소 (key-value 백엔드)
 *
 * <p>여러 워커/인스턴스가 같은 키를 동시에 증가시키므로
 * 반드시 백엔드의 원자적 증가 연산을 사용해야 합니다. (조회 후 저장 금지)</p>
 */
public interface CounterStore extends ReachableDatastore {

    /**
     * 키의 값을 1 증가시키고 증가된 값을 반환
     *
     * <p>키가 없으면 0에서 시작하므로 첫 호출은 1을 반환합니다.</p>
     *
     * @throws com.coderco.common.exception.BackendUnavailableException 백엔드 장애 시
     */
    long increment(String key);

    /**
     * 현재 값 조회 (한 번도 증가되지 않은 키는 0)
     *
     * @throws com.coderco.common.exception.BackendUnavailableException 백엔드 장애 시
     */
    long get(String key);
}
