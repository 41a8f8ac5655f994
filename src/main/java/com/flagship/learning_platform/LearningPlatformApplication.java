package com.flagship.learning_platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the learning platform service.
 *
 * Hosts enrollment, lecture progress, certificate issuance and the
 * payment-to-enrollment bridge behind one Spring Boot process.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class LearningPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(LearningPlatformApplication.class, args);
    }
}
