package com.coderco.version;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = {
        "com.coderco.version",
        "com.coderco.common.exception",  // GlobalExceptionHandler 스캔
        "com.coderco.common.logging",    // RequestIdFilter 등록
        "com.coderco.common.startup"     // StartupGate, ServiceLifecycle 스캔
})
@ConfigurationPropertiesScan
public class VersionApplication {
    public static void main(String[] args) {
        SpringApplication.run(VersionApplication.class, args);
    }
}
