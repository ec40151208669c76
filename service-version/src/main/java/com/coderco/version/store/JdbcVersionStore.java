package com.coderco.version.store;

import com.coderco.common.exception.BackendUnavailableException;
import com.coderco.common.store.VersionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.function.Supplier;

/**
 * MySQL 기반 조회 저장소
 *
 * <p>데이터를 변경하지 않습니다. 커넥션 획득 → 쿼리 실행 → 첫 행 첫 컬럼 조회 → 풀 반환은 JdbcTemplate이 처리합니다.</p>
 */
@RequiredArgsConstructor
@Slf4j
public class JdbcVersionStore implements VersionStore {

    static final String VERSION_QUERY = "SELECT VERSION()";
    static final String PING_QUERY = "SELECT 1";

    private static final String BACKEND = "mysql";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public String backendName() {
        return BACKEND;
    }

    @Override
    public String fetchVersion() {
        String version = execute(VERSION_QUERY, () -> jdbcTemplate.queryForObject(VERSION_QUERY, String.class));
        if (version == null) {
            throw new BackendUnavailableException(BACKEND, "MySQL returned no version");
        }
        return version;
    }

    @Override
    public void ping() {
        execute(PING_QUERY, () -> jdbcTemplate.queryForObject(PING_QUERY, Integer.class));
    }

    private <T> T execute(String sql, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.warn("[MySQL] 쿼리 실패: sql={}, cause={}", sql, e.getMessage());
            throw new BackendUnavailableException(BACKEND, "MySQL query failed: " + sql, e);
        }
    }
}
