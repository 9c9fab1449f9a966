package com.scifund.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * SciFund Platform API Application
 *
 * Milestone-gated research crowdfunding ledger.
 * Java 17 + Spring Boot 3.4.x
 */
@SpringBootApplication(scanBasePackages = "com.scifund")
@EntityScan(basePackages = "com.scifund.core.domain")
@EnableJpaRepositories(basePackages = "com.scifund.core.repository")
public class ScifundApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScifundApiApplication.class, args);
    }
}
