package com.marketplace.shared.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.shared.events.DomainEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for domain events.
 *
 * Serializes the event to JSON, copies its identity into record headers
 * (event-type, event-id, correlation-id) and counts outcomes.
 * Callers choose the partition key; records sharing a key keep their relative order.
 */
@Slf4j
@Component
public class EventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Counter publishSuccessCounter;
    private final Counter publishErrorCounter;
    private final Timer publishTimer;

    public EventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                          ObjectMapper objectMapper,
                          MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.publishSuccessCounter = Counter.builder("kafka.messages.published")
                .tag("status", "success")
                .description("Kafka messages acknowledged by the broker")
                .register(meterRegistry);
        this.publishErrorCounter = Counter.builder("kafka.messages.published")
                .tag("status", "error")
                .description("Kafka messages that failed to serialize or publish")
                .register(meterRegistry);
        this.publishTimer = Timer.builder("kafka.publish.duration")
                .description("Time from send to broker acknowledgement")
                .register(meterRegistry);
    }

    /**
     * Publish an event. Serialization failures complete the returned future exceptionally
     * rather than throwing.
     *
     * @param topic        Kafka topic ({@code EventTypes} constant)
     * @param event        the event
     * @param partitionKey record key; events with the same key are delivered in order
     */
    public CompletableFuture<SendResult<String, String>> publish(String topic, DomainEvent event, String partitionKey) {
        Timer.Sample sample = Timer.start();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: eventId={}, type={}", event.getId(), event.getType(), e);
            publishErrorCounter.increment();
            return CompletableFuture.failedFuture(e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, partitionKey, payload);
        record.headers()
                .add(new RecordHeader("event-type", event.getType().getBytes(StandardCharsets.UTF_8)))
                .add(new RecordHeader("event-id", event.getId().getBytes(StandardCharsets.UTF_8)))
                .add(new RecordHeader("correlation-id", event.getCorrelationId().getBytes(StandardCharsets.UTF_8)));

        return kafkaTemplate.send(record)
                .whenComplete((result, ex) -> {
                    sample.stop(publishTimer);
                    if (ex == null) {
                        publishSuccessCounter.increment();
                        log.debug("Event published: topic={}, key={}, eventId={}, partition={}, offset={}",
                                topic, partitionKey, event.getId(),
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    } else {
                        publishErrorCounter.increment();
                        log.error("Failed to publish event: topic={}, key={}, eventId={}, error={}",
                                topic, partitionKey, event.getId(), ex.getMessage(), ex);
                    }
                });
    }
}
