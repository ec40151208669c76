package com.coderco.counter.store;

import com.coderco.common.exception.BackendUnavailableException;
import com.coderco.common.store.CounterStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.client.RedisException;

import java.util.function.Supplier;

/**
 * Redis 기반 카운터 저장소
 *
 * <h3>원자성</h3>
 * <ul>
 *   <li>RAtomicLong.incrementAndGet() → Redis INCR 한 번</li>
 *   <li>서버에서 읽기+1이 한 단계로 처리되므로 여러 인스턴스가 동시에 호출해도 갱신 유실 없음</li>
 *   <li>값은 일반 정수 문자열로 저장 (redis-cli의 INCR/GET과 호환)</li>
 * </ul>
 */
@RequiredArgsConstructor
@Slf4j
public class RedisCounterStore implements CounterStore {

    private static final String BACKEND = "redis";

    private final RedissonClient redissonClient;

    @Override
    public String backendName() {
        return BACKEND;
    }

    @Override
    public long increment(String key) {
        return execute("INCR " + key, () -> redissonClient.getAtomicLong(key).incrementAndGet());
    }

    @Override
    public long get(String key) {
        // 키가 없으면 RAtomicLong.get()은 0을 반환
        return execute("GET " + key, () -> redissonClient.getAtomicLong(key).get());
    }

    @Override
    public void ping() {
        boolean alive = execute("PING", () -> redissonClient.getRedisNodes(RedisNodes.SINGLE).pingAll());
        if (!alive) {
            throw new BackendUnavailableException(BACKEND, "Redis did not answer PING");
        }
    }

    private <T> T execute(String command, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (RedisException e) {
            log.warn("[Redis] 명령 실패: command={}, cause={}", command, e.getMessage());
            throw new BackendUnavailableException(BACKEND, "Redis command failed: " + command, e);
        }
    }
}
