package com.project.image.charge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the Spring Boot application. Only bootstraps the app; the charge field
 * computation lives in the service package.
 *
 * @SpringBootApplication triggers component scanning and auto-configuration for this package tree.
 */
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
