package com.coderco.common.startup;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.util.concurrent.atomic.AtomicReference;

@Slf4j
public class ServiceLifecycle {

    private final AtomicReference<ServiceState> state = new AtomicReference<>(ServiceState.STARTING);

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (state.compareAndSet(ServiceState.STARTING, ServiceState.READY)) {
            log.info("서비스 상태 전환: {} → {}", ServiceState.STARTING, ServiceState.READY);
        }
    }

    public ServiceState getState() {
        return state.get();
    }
}
