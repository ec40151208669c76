package com.coderco.counter.store;

import com.coderco.common.exception.BackendUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RAtomicLong;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.api.redisnode.RedisSingle;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisCounterStoreTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RAtomicLong atomicLong;

    private RedisCounterStore store;

    @BeforeEach
    void setUp() {
        store = new RedisCounterStore(redissonClient);
    }

    @Test
    @DisplayName("increment는 서버 측 원자 연산(incrementAndGet)만 사용한다")
    void increment_usesAtomicIncrement() {
        given(redissonClient.getAtomicLong("visits")).willReturn(atomicLong);
        given(atomicLong.incrementAndGet()).willReturn(1L);

        assertThat(store.increment("visits")).isEqualTo(1L);

        verify(atomicLong, never()).get();
        verify(atomicLong, never()).set(org.mockito.ArgumentMatchers.anyLong());
    }

    @Test
    @DisplayName("한 번도 증가하지 않은 키는 0")
    void get_missingKey_returnsZero() {
        given(redissonClient.getAtomicLong("never-touched")).willReturn(atomicLong);
        given(atomicLong.get()).willReturn(0L);

        assertThat(store.get("never-touched")).isZero();
    }

    @Test
    @DisplayName("타임아웃 실패 후 다음 호출은 저장된 값에서 이어서 증가한다")
    void increment_afterTimeout_resumesFromStoredValue() {
        given(redissonClient.getAtomicLong("visits")).willReturn(atomicLong);
        given(atomicLong.incrementAndGet())
                .willThrow(new RedisTimeoutException("Command execution timeout"))
                .willReturn(4L);

        assertThatThrownBy(() -> store.increment("visits"))
                .isInstanceOf(BackendUnavailableException.class)
                .hasCauseInstanceOf(RedisTimeoutException.class);

        assertThat(store.increment("visits")).isEqualTo(4L);
    }

    @Test
    @DisplayName("연결 실패는 BackendUnavailableException(redis)로 변환된다")
    void increment_connectionRefused_mapsToBackendUnavailable() {
        given(redissonClient.getAtomicLong("visits")).willReturn(atomicLong);
        given(atomicLong.incrementAndGet()).willThrow(new RedisConnectionException("Connection refused"));

        assertThatThrownBy(() -> store.increment("visits"))
                .isInstanceOf(BackendUnavailableException.class)
                .extracting("backend").isEqualTo("redis");
    }

    @Test
    @DisplayName("PING 응답이 없으면 ping()은 실패한다")
    void ping_noAnswer_throws() {
        RedisSingle single = org.mockito.Mockito.mock(RedisSingle.class);
        given(redissonClient.getRedisNodes(RedisNodes.SINGLE)).willReturn(single);
        given(single.pingAll()).willReturn(false);

        assertThatThrownBy(() -> store.ping()).isInstanceOf(BackendUnavailableException.class);
    }
}
