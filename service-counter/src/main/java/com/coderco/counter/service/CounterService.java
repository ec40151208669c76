package com.coderco.counter.service;

import com.coderco.common.store.CounterStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 방문 카운터 서비스
 *
 * <p>카운터 값은 Redis가 유일한 원본입니다. 서비스는 값을 캐시하지 않습니다.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CounterService {

    public static final String VISITS_KEY = "visits";
    public static final String WELCOME_MESSAGE = "Welcome to my Flask app";

    private static final String VISIT_MESSAGE_FORMAT = "This page has been visited %d times.";

    private final CounterStore counterStore;

    /**
     * 고정 환영 문구 (백엔드 상태와 무관)
     */
    public String greet() {
        return WELCOME_MESSAGE;
    }

    /**
     * 방문 횟수 증가 후 안내 문구 반환
     *
     * @throws com.coderco.common.exception.BackendUnavailableException Redis 장애 시
     */
    public String countVisit() {
        long count = counterStore.increment(VISITS_KEY);
        log.info("방문 횟수: {}", count);
        return String.format(VISIT_MESSAGE_FORMAT, count);
    }
}
