package com.ai.leadqualifier.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.ai.leadqualifier")
@EnableJpaRepositories(basePackages = "com.ai.leadqualifier.repository")
@EntityScan(basePackages = "com.ai.leadqualifier.entity")
public class LeadQualifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadQualifierApplication.class, args);
    }
}
