package com.coderco.counter.config;

import com.coderco.common.startup.StartupGate;
import com.coderco.common.store.CounterStore;
import com.coderco.counter.store.RedisCounterStore;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redis 연결 설정
 *
 * <h3>구성 요소</h3>
 * <ul>
 *   <li>RedissonClient: 프로세스 전체가 공유하는 연결 핸들 (StartupGate 통과 후 생성)</li>
 *   <li>CounterStore: RedissonClient를 감싼 카운터 저장소</li>
 * </ul>
 *
 * <p>redisson-spring-boot-starter의 자동 설정 대신 직접 생성합니다.
 * 자동 설정은 Redis가 아직 준비되지 않았을 때 기동 자체가 바로 실패하기 때문입니다.</p>
 */
@Configuration
@Slf4j
public class RedisConfig {

    static final String BACKEND = "redis";

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(RedisBackendProperties properties, StartupGate startupGate) {
        log.info("Redis 연결 대상: {}, database={}", properties.address(), properties.database());
        return startupGate.connect(BACKEND, () -> Redisson.create(redissonConfig(properties)));
    }

    @Bean
    public CounterStore counterStore(RedissonClient redissonClient) {
        return new RedisCounterStore(redissonClient);
    }

    static Config redissonConfig(RedisBackendProperties properties) {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(properties.address())
                .setDatabase(properties.database())
                .setPassword(properties.password())
                .setTimeout((int) properties.timeout().toMillis())
                .setConnectTimeout((int) properties.connectTimeout().toMillis())
                // 재시도는 StartupGate와 요청 단위 503 응답이 담당
                .setRetryAttempts(0);
        return config;
    }
}
