package com.coderco.version.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * MySQL 연결 설정 (기동 시 한 번 바인딩, 이후 불변)
 *
 * <pre>
 * version:
 *   mysql:
 *     host: ${MYSQL_HOST:mysql}
 *     port: ${MYSQL_PORT:3306}
 *     user: ${MYSQL_USER:root}
 *     password: ${MYSQL_PASSWORD:root}
 *     database: ${MYSQL_DATABASE:testdb}
 *     connect-timeout: 2s   # 풀에서 커넥션을 얻는 최대 대기 시간
 *     query-timeout: 2s     # 쿼리 단위 타임아웃
 *     pool-size: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "version.mysql")
public record MysqlBackendProperties(
        @DefaultValue("mysql") String host,
        @DefaultValue("3306") int port,
        @DefaultValue("root") String user,
        @DefaultValue("root") String password,
        @DefaultValue("testdb") String database,
        @DefaultValue("2s") Duration connectTimeout,
        @DefaultValue("2s") Duration queryTimeout,
        @DefaultValue("5") int poolSize
) {
    /**
     * Hikari가 허용하는 connectionTimeout 최소값
     */
    private static final long MIN_CONNECT_TIMEOUT_MS = 250;

    public MysqlBackendProperties {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("version.mysql.host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("version.mysql.port out of range: " + port);
        }
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("version.mysql.database must not be blank");
        }
        if (connectTimeout.toMillis() < MIN_CONNECT_TIMEOUT_MS) {
            throw new IllegalArgumentException("version.mysql.connect-timeout must be >= 250ms");
        }
        if (queryTimeout.toSeconds() < 1) {
            throw new IllegalArgumentException("version.mysql.query-timeout must be >= 1s");
        }
        if (poolSize < 1) {
            throw new IllegalArgumentException("version.mysql.pool-size must be >= 1: " + poolSize);
        }
    }

    public String jdbcUrl() {
        return "jdbc:mysql://" + host + ":" + port + "/" + database
                + "?connectTimeout=" + connectTimeout.toMillis()
                + "&useSSL=false&allowPublicKeyRetrieval=true";
    }
}
