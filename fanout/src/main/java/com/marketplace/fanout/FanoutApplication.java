package com.marketplace.fanout;

import com.marketplace.shared.kafka.IdempotencyService;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Fan-out Service — Entry Point
 *
 * Holds the WebSocket connections and their channel memberships. Consumes channel events from
 * Kafka and pushes them to subscribers; handles direct messages between buyers and sellers.
 * No database: the shared module's JPA auto-configuration is switched off.
 *
 * Port: 8085 (see application.yml)
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, HibernateJpaAutoConfiguration.class})
@EnableKafka
@Import(IdempotencyService.class)
public class FanoutApplication {
    public static void main(String[] args) {
        SpringApplication.run(FanoutApplication.class, args);
    }
}
