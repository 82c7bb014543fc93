package com.fraudplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.fraudplatform")
public class FraudPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudPlatformApplication.class, args);
    }
}
