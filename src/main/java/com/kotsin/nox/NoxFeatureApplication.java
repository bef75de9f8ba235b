package com.kotsin.nox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


/**
 * Spring Boot application hosting the NOx feature preprocessing pipeline.
 */
@SpringBootApplication
public class NoxFeatureApplication {

    public static void main(String[] args) {
        SpringApplication.run(NoxFeatureApplication.class, args);
    }
}
