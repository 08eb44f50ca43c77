package com.ridedispatch.api.dispatch.service;

import com.ridedispatch.api.dispatch.service.config.DispatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {"com.ridedispatch.api.dispatch.service", "com.ridedispatch.api.shared"})
@EntityScan(basePackages = {"com.ridedispatch.api.dispatch.service.entity", "com.ridedispatch.api.shared.entities"})
@EnableJpaRepositories(basePackages = {"com.ridedispatch.api.dispatch.service.repository"})
@EnableConfigurationProperties(DispatchProperties.class)
@EnableScheduling
public class DispatchServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(DispatchServiceApplication.class, args);
    }
}
