package com.coderco.version.config;

import com.coderco.common.startup.StartupGate;
import com.coderco.common.store.VersionStore;
import com.coderco.version.store.JdbcVersionStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * MySQL 연결 설정
 *
 * <h3>구성 요소</h3>
 * <ul>
 *   <li>HikariDataSource: 커넥션 풀 (조회 후 커넥션은 풀로 반환)</li>
 *   <li>JdbcTemplate: 쿼리 타임아웃 적용</li>
 *   <li>VersionStore: StartupGate로 MySQL 응답을 확인한 뒤 등록</li>
 * </ul>
 */
@Configuration
@Slf4j
public class MysqlConfig {

    private static final String POOL_NAME = "version-mysql";

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(MysqlBackendProperties properties) {
        log.info("MySQL 연결 대상: host={}, port={}, database={}",
                properties.host(), properties.port(), properties.database());

        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setJdbcUrl(properties.jdbcUrl());
        config.setUsername(properties.user());
        config.setPassword(properties.password());
        config.setMaximumPoolSize(properties.poolSize());
        config.setConnectionTimeout(properties.connectTimeout().toMillis());
        // 풀 생성 시점에는 연결하지 않음 (대기는 StartupGate 담당)
        config.setInitializationFailTimeout(-1);
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource, MysqlBackendProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout((int) properties.queryTimeout().toSeconds());
        return jdbcTemplate;
    }

    @Bean
    public VersionStore versionStore(JdbcTemplate jdbcTemplate, StartupGate startupGate) {
        JdbcVersionStore store = new JdbcVersionStore(jdbcTemplate);
        startupGate.awaitReachable(store);
        return store;
    }
}
