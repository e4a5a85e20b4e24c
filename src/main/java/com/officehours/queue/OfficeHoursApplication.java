package com.officehours.queue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.officehours.queue.repository")
@EntityScan(basePackages = "com.officehours.queue.entity")
public class OfficeHoursApplication {

    public static void main(String[] args) {
        SpringApplication.run(OfficeHoursApplication.class, args);
    }
}
