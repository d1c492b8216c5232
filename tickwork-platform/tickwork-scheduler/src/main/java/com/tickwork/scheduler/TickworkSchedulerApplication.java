package com.tickwork.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Tickwork custom job scheduler.
 */
@SpringBootApplication(scanBasePackages = "com.tickwork")
@EntityScan(basePackages = "com.tickwork.core.domain")
@EnableJpaRepositories(basePackages = "com.tickwork.core.repository")
public class TickworkSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TickworkSchedulerApplication.class, args);
    }
}
