package com.coderco.common.store;

/**
 * 읽기 전용 조회 저장소 (관계형 백엔드)
 *
 * <p>카운터 대신 고정 쿼리 한 건으로 연결이 살아있음을 보여줍니다. 데이터를 변경하지 않습니다.</p>
 */
public interface VersionStore extends ReachableDatastore {

    /**
     * 서버 버전 문자열 조회 (가공 없이 그대로 반환)
     *
     * @throws com.coderco.common.exception.BackendUnavailableException 백엔드 장애 시
     */
    String fetchVersion();
}
