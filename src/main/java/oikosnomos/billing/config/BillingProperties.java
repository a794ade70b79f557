package oikosnomos.billing.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration properties for the billing engine.
 * Defaults can be overridden in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "oikosnomos.billing")
@Validated
public class BillingProperties {

    /** Trailing window of raw readings kept in memory. */
    @NotNull
    private Duration retention = Duration.ofHours(24);

    /**
     * Nominal interval between two readings of one device. Readings without
     * energy_wh are integrated as power_w over this interval, an approximation.
     */
    @NotNull
    private Duration samplingInterval = Duration.ofSeconds(5);

    /** Readings timestamped further than this in the future are rejected. */
    @NotNull
    private Duration maxFutureSkew = Duration.ofSeconds(30);

    /** Period of the snapshot publisher. */
    @NotNull
    private Duration snapshotInterval = Duration.ofMinutes(5);

    /** Delay before the first snapshot tick, so readings can arrive first. */
    @NotNull
    private Duration snapshotInitialDelay = Duration.ofSeconds(30);

    /** Known device categories. */
    @NotEmpty
    private List<String> deviceCategories = new ArrayList<>(Arrays.asList(
            "base_load", "office", "hvac", "garden_pump", "ev_charger", "entertainment", "kitchen"));

    /** Homes to ingest and bill. Empty means every row of the homes table. */
    private List<String> homeIds = new ArrayList<>();

    /** Threads computing snapshots in parallel across homes. */
    @Positive
    private int billingThreads = 4;

    /** Home ticks waiting for a billing thread; beyond this a tick is skipped. */
    @Positive
    private int billingQueueCapacity = 1_000;

    @Valid
    private Persistence persistence = new Persistence();

    @Valid
    private Mqtt mqtt = new Mqtt();

    @Data
    public static class Persistence {
        @Positive
        private int coreSize = 2;
        @Positive
        private int maxSize = 4;
        /** Queued writes beyond this are dropped and counted. */
        @Positive
        private int queueCapacity = 10_000;
        /** How long in-flight writes may run after shutdown starts. */
        private Duration shutdownGrace = Duration.ofSeconds(10);
        /** Retries after the first failed attempt. */
        @Min(0)
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class Mqtt {
        @NotBlank
        private String brokerUrl = "tcp://localhost:1883";
        @NotBlank
        private String clientId = "billing-engine";
        @Min(0)
        @Max(2)
        private int qos = 0;
        /** Also bounds how long a blocking publish may wait. */
        @NotNull
        private Duration connectionTimeout = Duration.ofSeconds(10);
        /** Backoff between attempts at the first connection, doubling up to the max. */
        @NotNull
        private Duration initialReconnectDelay = Duration.ofSeconds(1);
        @NotNull
        private Duration maxReconnectDelay = Duration.ofSeconds(60);
        /** Snapshots waiting to be published; beyond this they are dropped. */
        @Positive
        private int publishQueueCapacity = 100;
    }
}
