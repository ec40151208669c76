package com.coderco.version.service;

import com.coderco.common.store.VersionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class VersionService {

    private static final String GREETING_PREFIX = "Hello, World! MySQL version: ";

    private final VersionStore versionStore;

    /**
     * MySQL 서버 버전을 포함한 인사 문구 (버전 문자열은 가공하지 않음)
     *
     * @throws com.coderco.common.exception.BackendUnavailableException MySQL 장애 시
     */
    public String describe() {
        String version = versionStore.fetchVersion();
        log.debug("MySQL 버전 조회: {}", version);
        return GREETING_PREFIX + version;
    }
}
