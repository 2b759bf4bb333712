package com.saga.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Runs the saga engine with the order fulfillment saga registered.
 */
@SpringBootApplication(scanBasePackages = "com.saga")
public class SagaExamplesApplication {

    public static void main(String[] args) {
        SpringApplication.run(SagaExamplesApplication.class, args);
    }
}
