package com.coderco.counter.controller;

import com.coderco.counter.service.CounterService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class CounterController {

    static final String TEXT_PLAIN_UTF8 = MediaType.TEXT_PLAIN_VALUE + ";charset=UTF-8";

    private final CounterService counterService;

    /**
     * 환영 문구
     */
    @GetMapping(value = "/", produces = TEXT_PLAIN_UTF8)
    public String hello() {
        return counterService.greet();
    }

    /**
     * 방문 횟수 증가
     */
    @GetMapping(value = "/count", produces = TEXT_PLAIN_UTF8)
    public String visitCount() {
        return counterService.countVisit();
    }
}
