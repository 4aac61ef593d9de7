package com.marketplace.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.datatype.jsr310.deser.InstantDeserializer;
import com.fasterxml.jackson.datatype.jsr310.ser.InstantSerializer;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Envelope shared by every event that leaves a service over Kafka.
 *
 *  - id:            unique event identifier, used for consumer-side deduplication
 *  - type:          dot-notation name from {@link EventTypes}
 *  - source:        originating service, e.g. "/services/marketplace"
 *  - time:          when the event was created
 *  - correlationId: ties the event to the transition that produced it
 */
@Getter
@ToString
public abstract class DomainEvent {

    private final String id;
    private final String type;
    private final String source;

    @JsonSerialize(using = InstantSerializer.class)
    @JsonDeserialize(using = InstantDeserializer.class)
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private final Instant time;

    private final String correlationId;
    private final int version;

    protected DomainEvent(String type, String source, String correlationId, int version) {
        this.id = UUID.randomUUID().toString();
        this.type = type;
        this.source = source;
        this.time = Instant.now();
        this.correlationId = correlationId != null ? correlationId : UUID.randomUUID().toString();
        this.version = version;
    }

    protected DomainEvent(String type, String source, String correlationId) {
        this(type, source, correlationId, 1);
    }
}
