package com.coderco.common.startup;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 기동 대기(StartupGate) 설정
 *
 * <pre>
 * startup:
 *   gate:
 *     max-attempts: 0        # 0 = 무제한 재시도
 *     initial-backoff: 500ms
 *     multiplier: 2.0        # 1.0 = 고정 간격
 *     max-backoff: 10s
 * </pre>
 */
@ConfigurationProperties(prefix = "startup.gate")
public record StartupProperties(
        @DefaultValue("0") int maxAttempts,
        @DefaultValue("500ms") Duration initialBackoff,
        @DefaultValue("2.0") double multiplier,
        @DefaultValue("10s") Duration maxBackoff
) {
    public StartupProperties {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("startup.gate.max-attempts must be >= 0: " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.toMillis() < 1) {
            throw new IllegalArgumentException("startup.gate.initial-backoff must be at least 1ms");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("startup.gate.multiplier must be >= 1.0: " + multiplier);
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("startup.gate.max-backoff must be >= initial-backoff");
        }
    }

    public boolean isUnbounded() {
        return maxAttempts == 0;
    }
}
