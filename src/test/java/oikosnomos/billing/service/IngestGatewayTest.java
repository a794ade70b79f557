package oikosnomos.billing.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import oikosnomos.billing.exception.ReadingValidationException;
import oikosnomos.billing.model.Reading;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class IngestGatewayTest {

    private static final String TOPIC = "home/home-1/device/hvac/power";

    private EnergyAccumulator accumulator;
    private SimpleMeterRegistry registry;
    private IngestGateway gateway;

    @BeforeEach
    void setUp() {
        accumulator = mock(EnergyAccumulator.class);
        registry = new SimpleMeterRegistry();
        gateway = new IngestGateway(accumulator, new ObjectMapper(), registry);
    }

    @Test
    void handle_validMessage_addsReading() {
        boolean accepted = gateway.handle(TOPIC, json("""
                {"timestamp": "2025-07-15T10:15:30-07:00", "device_category": "hvac", "power_w": 1250.5, "energy_wh": 1.7}
                """));

        assertTrue(accepted);
        ArgumentCaptor<Reading> captor = ArgumentCaptor.forClass(Reading.class);
        verify(accumulator).addReading(captor.capture());
        Reading reading = captor.getValue();
        assertEquals("home-1", reading.getHomeId());
        assertEquals("hvac", reading.getDeviceCategory());
        assertEquals(Instant.parse("2025-07-15T17:15:30Z"), reading.getTimestamp());
        assertEquals(1250.5, reading.getPowerW());
        assertEquals(1.7, reading.getEnergyWh());
    }

    @Test
    void handle_categoryOnlyInTopic_usesTopicCategory() {
        assertTrue(gateway.handle(TOPIC, json("{\"timestamp\": \"2025-07-15T17:00:00Z\", \"power_w\": 10}")));

        ArgumentCaptor<Reading> captor = ArgumentCaptor.forClass(Reading.class);
        verify(accumulator).addReading(captor.capture());
        assertEquals("hvac", captor.getValue().getDeviceCategory());
        assertNull(captor.getValue().getEnergyWh());
    }

    @Test
    void handle_malformedJson_isDroppedAndCounted() {
        assertFalse(gateway.handle(TOPIC, json("{ nope")));

        verifyNoInteractions(accumulator);
        assertEquals(1.0, registry.counter("billing.readings.rejected", "reason", "malformed").count());
    }

    @Test
    void handle_badTimestamp_isDropped() {
        assertFalse(gateway.handle(TOPIC, json("{\"timestamp\": \"yesterday\", \"power_w\": 10}")));

        assertEquals(1.0, registry.counter("billing.readings.rejected", "reason", "bad_timestamp").count());
    }

    @Test
    void handle_categoryMismatch_isDropped() {
        assertFalse(gateway.handle(TOPIC, json("""
                {"timestamp": "2025-07-15T17:00:00Z", "device_category": "kitchen", "power_w": 10}
                """)));

        verifyNoInteractions(accumulator);
        assertEquals(1.0, registry.counter("billing.readings.rejected", "reason", "category_mismatch").count());
    }

    @Test
    void handle_foreignTopic_isDropped() {
        assertFalse(gateway.handle("home/home-1/billing/today_cost", json("{}")));

        assertEquals(1.0, registry.counter("billing.readings.rejected", "reason", "bad_topic").count());
    }

    @Test
    void handle_rejectedByAccumulator_countsItsReason() {
        doThrow(new ReadingValidationException("future_timestamp", "too far ahead"))
                .when(accumulator).addReading(any(Reading.class));

        assertFalse(gateway.handle(TOPIC, json("{\"timestamp\": \"2030-01-01T00:00:00Z\", \"power_w\": 10}")));

        assertEquals(1.0, registry.counter("billing.readings.rejected", "reason", "future_timestamp").count());
    }

    @Test
    void handle_unexpectedFailure_neverThrows() {
        doThrow(new IllegalStateException("boom")).when(accumulator).addReading(any(Reading.class));

        assertFalse(gateway.handle(TOPIC, json("{\"timestamp\": \"2025-07-15T17:00:00Z\", \"power_w\": 10}")));
    }

    private static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
