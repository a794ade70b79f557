package oikosnomos.billing.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.dto.ReadingMessage;
import oikosnomos.billing.exception.ReadingValidationException;
import oikosnomos.billing.model.Reading;
import oikosnomos.billing.transport.TopicNames;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Entry point of inbound readings. Invalid readings are dropped with a warning and
 * a counter; nothing thrown here reaches the transport.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestGateway {

    private final EnergyAccumulator energyAccumulator;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    /**
     * Handles one message of home/{home_id}/device/{category}/power. Returns true when accepted.
     */
    public boolean handle(String topic, byte[] payload) {
        try {
            energyAccumulator.addReading(toReading(topic, payload));
            return true;
        } catch (ReadingValidationException e) {
            meterRegistry.counter("billing.readings.rejected", "reason", e.getReason()).increment();
            log.warn("Dropping reading on {}: {}", topic, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            meterRegistry.counter("billing.readings.rejected", "reason", "error").increment();
            log.error("Unexpected failure ingesting reading on {}: {}", topic, e.getMessage(), e);
            return false;
        }
    }

    Reading toReading(String topic, byte[] payload) {
        TopicNames.ReadingTopic source = TopicNames.parseReadingTopic(topic)
                .orElseThrow(() -> new ReadingValidationException("bad_topic", "Not a reading topic: " + topic));

        ReadingMessage message;
        try {
            message = objectMapper.readValue(payload, ReadingMessage.class);
        } catch (IOException e) {
            throw new ReadingValidationException("malformed", "Malformed reading payload: " + e.getMessage());
        }

        if (message.getTimestamp() == null) {
            throw new ReadingValidationException("missing_timestamp", "Reading has no timestamp");
        }
        Instant timestamp;
        try {
            timestamp = OffsetDateTime.parse(message.getTimestamp()).toInstant();
        } catch (DateTimeParseException e) {
            throw new ReadingValidationException("bad_timestamp",
                    "Timestamp '" + message.getTimestamp() + "' is not RFC3339");
        }
        if (message.getPowerW() == null) {
            throw new ReadingValidationException("missing_power", "Reading has no power_w");
        }

        String category = message.getDeviceCategory() != null ? message.getDeviceCategory() : source.category();
        if (!category.equals(source.category())) {
            throw new ReadingValidationException("category_mismatch", "Payload category '" + category
                    + "' does not match topic category '" + source.category() + "'");
        }

        return Reading.builder()
                .timestamp(timestamp)
                .homeId(source.homeId())
                .deviceCategory(category)
                .powerW(message.getPowerW())
                .energyWh(message.getEnergyWh())
                .build();
    }
}
