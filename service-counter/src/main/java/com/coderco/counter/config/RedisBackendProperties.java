package com.coderco.counter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Redis 연결 설정 (기동 시 한 번 바인딩, 이후 불변)
 *
 * <pre>
 * counter:
 *   redis:
 *     host: ${REDIS_HOST:redis}
 *     port: ${REDIS_PORT:6379}
 *     password: ${REDIS_PASSWORD:}
 *     database: ${REDIS_DATABASE:0}
 *     timeout: 2s            # 명령 단위 타임아웃
 *     connect-timeout: 2s
 * </pre>
 */
@ConfigurationProperties(prefix = "counter.redis")
public record RedisBackendProperties(
        @DefaultValue("redis") String host,
        @DefaultValue("6379") int port,
        String password,
        @DefaultValue("0") int database,
        @DefaultValue("2s") Duration timeout,
        @DefaultValue("2s") Duration connectTimeout
) {
    public RedisBackendProperties {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("counter.redis.host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("counter.redis.port out of range: " + port);
        }
        if (database < 0) {
            throw new IllegalArgumentException("counter.redis.database must be >= 0: " + database);
        }
        if (password != null && password.isBlank()) {
            password = null;
        }
    }

    public String address() {
        return "redis://" + host + ":" + port;
    }
}
