package com.github.dimitryivaniuta.relay;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Schema Relay service.
 * Accepts schema-tagged payloads, validates and transforms them, and forwards them to their destination.
 */
@Slf4j
@SpringBootApplication
public class RelayServiceApplication {

    public static void main(final String[] args) {
        SpringApplication.run(RelayServiceApplication.class, args);
        log.info("Schema Relay service started successfully.");
    }
}
