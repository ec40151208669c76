package com.coderco.version.store;

import com.coderco.common.exception.DependencyUnreachableException;
import com.coderco.common.startup.StartupGate;
import com.coderco.common.startup.StartupProperties;
import com.coderco.common.store.VersionStore;
import com.coderco.version.config.MysqlBackendProperties;
import com.coderco.version.config.MysqlConfig;
import com.coderco.version.service.VersionService;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 실제 MySQL 컨테이너 대상 테스트 (Docker가 없으면 건너뜀)
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcVersionStoreContainerTest {

    @Container
    private static final MySQLContainer<?> MYSQL = new MySQLContainer<>(DockerImageName.parse("mysql:8.0"))
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test")
            .withStartupTimeout(Duration.ofMinutes(2));

    private final MysqlConfig mysqlConfig = new MysqlConfig();

    private MysqlBackendProperties properties(String password) {
        return new MysqlBackendProperties(MYSQL.getHost(), MYSQL.getMappedPort(MySQLContainer.MYSQL_PORT),
                MYSQL.getUsername(), password, MYSQL.getDatabaseName(),
                Duration.ofSeconds(2), Duration.ofSeconds(2), 2);
    }

    private StartupGate gate() {
        return new StartupGate(new StartupProperties(3, Duration.ofMillis(50), 2.0, Duration.ofMillis(200)));
    }

    @Test
    @DisplayName("연결 성공 시 Hello, World! MySQL version: X.Y.Z 형식으로 응답한다")
    void describe_matchesVersionPattern() {
        MysqlBackendProperties properties = properties(MYSQL.getPassword());
        try (HikariDataSource dataSource = mysqlConfig.dataSource(properties)) {
            JdbcTemplate jdbcTemplate = mysqlConfig.jdbcTemplate(dataSource, properties);
            VersionStore store = mysqlConfig.versionStore(jdbcTemplate, gate());

            String greeting = new VersionService(store).describe();

            assertThat(greeting).matches("Hello, World! MySQL version: \\d+\\.\\d+\\.\\d+.*");
            assertThat(greeting).endsWith(store.fetchVersion());
        }
    }

    @Test
    @DisplayName("인증 실패가 계속되면 StartupGate가 3회 시도 후 기동을 중단한다")
    void wrongPassword_failsStartupAfterMaxAttempts() {
        MysqlBackendProperties properties = properties("wrong-password");
        try (HikariDataSource dataSource = mysqlConfig.dataSource(properties)) {
            JdbcTemplate jdbcTemplate = mysqlConfig.jdbcTemplate(dataSource, properties);

            assertThatThrownBy(() -> mysqlConfig.versionStore(jdbcTemplate, gate()))
                    .isInstanceOf(DependencyUnreachableException.class)
                    .extracting("attempts").isEqualTo(3);
        }
    }
}
