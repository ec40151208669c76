package com.coderco.version.controller;

import com.coderco.version.service.VersionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class VersionController {

    static final String TEXT_PLAIN_UTF8 = MediaType.TEXT_PLAIN_VALUE + ";charset=UTF-8";

    private final VersionService versionService;

    /**
     * MySQL 버전 조회
     */
    @GetMapping(value = "/", produces = TEXT_PLAIN_UTF8)
    public String hello() {
        return versionService.describe();
    }
}
