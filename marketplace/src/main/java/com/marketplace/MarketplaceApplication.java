package com.marketplace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Marketplace Service — Entry Point
 *
 * Owns listings and orders: workflow validation, durable writes, and the post-commit effect
 * pipeline (audit, derived cache, search index, channel notifications).
 *
 * Port: 8080 (see application.yml)
 */
@SpringBootApplication
@EnableKafka
public class MarketplaceApplication {
    public static void main(String[] args) {
        SpringApplication.run(MarketplaceApplication.class, args);
    }
}
