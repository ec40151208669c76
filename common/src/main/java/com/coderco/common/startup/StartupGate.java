package com.coderco.common.startup;

import com.coderco.common.exception.DependencyUnreachableException;
import com.coderco.common.store.ReachableDatastore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 의존 데이터스토어가 연결 가능해질 때까지 기동을 막는 게이트
 *
 * <h3>왜 필요한가?</h3>
 * <p>컨테이너 오케스트레이션의 기동 순서 지정은 프로세스 실행 순서만 보장합니다.
 * 데이터스토어 프로세스가 떴다고 해서 바로 연결을 받을 수 있는 것은 아닙니다.</p>
 *
 * <h3>동작</h3>
 * <ol>
 *   <li>connector 실행 (연결 생성 또는 ping)</li>
 *   <li>실패 시 지수 백오프 후 재시도 (max-backoff로 상한)</li>
 *   <li>max-attempts 소진 시 {@link DependencyUnreachableException} (치명적)</li>
 * </ol>
 *
 * <p>빈 생성 과정에서 호출되므로 게이트를 통과하기 전에는 HTTP 커넥터가 열리지 않습니다.</p>
 */
@Slf4j
public class StartupGate {

    private final StartupProperties properties;
    private final IntervalFunction intervalFunction;

    public StartupGate(StartupProperties properties) {
        this.properties = properties;
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(
                properties.initialBackoff(), properties.multiplier(), properties.maxBackoff());
    }

    /**
     * 연결 핸들을 생성할 때까지 재시도
     *
     * @param dependency 의존 대상 이름 (로그/예외용)
     * @param connector  연결 핸들 생성 로직
     * @return 생성된 연결 핸들
     * @throws DependencyUnreachableException 최대 시도 횟수 소진 시
     */
    public <T> T connect(String dependency, Callable<T> connector) {
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = Retry.of("startup-" + dependency, retryConfig());

        retry.getEventPublisher().onRetry(event ->
                log.warn("[StartupGate] {} 연결 실패 ({}회차), {}ms 후 재시도: {}",
                        dependency,
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        describe(event.getLastThrowable())));

        log.info("[StartupGate] {} 연결 대기 시작: maxAttempts={}",
                dependency, properties.isUnbounded() ? "unbounded" : properties.maxAttempts());

        Callable<T> attempt = () -> {
            attempts.incrementAndGet();
            return connector.call();
        };

        try {
            T handle = Retry.decorateCallable(retry, attempt).call();
            log.info("[StartupGate] {} 연결 완료: attempts={}", dependency, attempts.get());
            return handle;
        } catch (Exception e) {
            log.error("[StartupGate] {} 연결 불가 - 기동 중단: attempts={}", dependency, attempts.get(), e);
            throw new DependencyUnreachableException(dependency, attempts.get(), e);
        }
    }

    /**
     * datastore.ping()이 성공할 때까지 대기
     */
    public void awaitReachable(ReachableDatastore datastore) {
        connect(datastore.backendName(), () -> {
            datastore.ping();
            return datastore;
        });
    }

    /**
     * n번째 실패 후 대기 시간 (ms)
     */
    public long backoffMillis(int failedAttempts) {
        return intervalFunction.apply(failedAttempts);
    }

    private RetryConfig retryConfig() {
        return RetryConfig.custom()
                .maxAttempts(properties.isUnbounded() ? Integer.MAX_VALUE : properties.maxAttempts())
                .intervalFunction(intervalFunction)
                .build();
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown";
        }
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
