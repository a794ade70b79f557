package oikosnomos.billing.service;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.event.BillingSnapshotComputedEvent;
import oikosnomos.billing.exception.DependencyException;
import oikosnomos.billing.exception.TariffConfigException;
import oikosnomos.billing.exception.TariffLookupException;
import oikosnomos.billing.model.BillingSnapshot;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic driver of billing. Every tick computes a snapshot for each home on the
 * billing pool, homes in parallel, and publishes a BillingSnapshotComputedEvent
 * for the transport and the store.
 *
 * At most one computation per home is in flight; a tick that finds the previous
 * one still running is skipped, not queued.
 */
@Service
@Slf4j
public class SnapshotPublisher {

    private final BillingCalculator billingCalculator;
    private final HomeService homeService;
    private final ApplicationEventPublisher eventPublisher;
    private final TaskExecutor billingExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Map<String, LocalDate> lastBillingDay = new ConcurrentHashMap<>();

    private volatile boolean stopped;

    public SnapshotPublisher(BillingCalculator billingCalculator,
                             HomeService homeService,
                             ApplicationEventPublisher eventPublisher,
                             @Qualifier("billingExecutor") TaskExecutor billingExecutor,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.billingCalculator = billingCalculator;
        this.homeService = homeService;
        this.eventPublisher = eventPublisher;
        this.billingExecutor = billingExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "#{@billingProperties.snapshotInterval.toMillis()}",
               initialDelayString = "#{@billingProperties.snapshotInitialDelay.toMillis()}")
    public void tick() {
        if (stopped) {
            return;
        }
        Instant now = clock.instant();
        List<String> homeIds;
        try {
            homeIds = homeService.billedHomeIds();
        } catch (DataAccessException e) {
            log.warn("Could not list homes, skipping billing tick: {}", e.getMessage());
            countTick("dependency_error");
            return;
        }
        log.debug("Billing tick at {} for {} home(s)", now, homeIds.size());
        for (String homeId : homeIds) {
            schedule(homeId, now);
        }
    }

    /**
     * Starts a computation for a home unless one is already running. Returns false when skipped.
     */
    boolean schedule(String homeId, Instant now) {
        if (!inFlight.add(homeId)) {
            log.warn("Billing for home {} is still running, skipping this tick", homeId);
            countTick("skipped");
            return false;
        }
        try {
            billingExecutor.execute(() -> {
                try {
                    runTick(homeId, now);
                } finally {
                    inFlight.remove(homeId);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            inFlight.remove(homeId);
            log.warn("Billing pool saturated, skipping tick for home {}", homeId);
            countTick("skipped");
            return false;
        }
    }

    void runTick(String homeId, Instant now) {
        BillingSnapshot snapshot;
        try {
            snapshot = billingCalculator.compute(homeId, now);
        } catch (DependencyException e) {
            String outcome = outcomeOf(e);
            log.warn("Billing tick for home {} aborted ({}): {}", homeId, outcome, e.getMessage());
            countTick(outcome);
            return;
        } catch (RuntimeException e) {
            log.error("Unexpected failure billing home {}: {}", homeId, e.getMessage(), e);
            countTick("error");
            return;
        }

        LocalDate previousDay = lastBillingDay.put(homeId, snapshot.getLocalDate());
        if (previousDay != null && !previousDay.equals(snapshot.getLocalDate())) {
            log.info("Local day rolled over for home {} ({} -> {}), today's totals restart",
                    homeId, previousDay, snapshot.getLocalDate());
        }

        eventPublisher.publishEvent(new BillingSnapshotComputedEvent(homeId, snapshot));
        countTick("success");
        log.info("Billing for home {}: today=${} projected=${} energy={} kWh rate={} co2={} kg",
                homeId, snapshot.getCostToday(), snapshot.getProjectedMonth(), snapshot.getEnergyTodayKwh(),
                snapshot.getCurrentRate(), snapshot.getCo2TodayKg());
    }

    boolean isInFlight(String homeId) {
        return inFlight.contains(homeId);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        log.info("Snapshot publisher stopped");
    }

    private static String outcomeOf(DependencyException e) {
        if (e.getCause() instanceof TariffLookupException) {
            return "lookup_error";
        }
        if (e.getCause() instanceof TariffConfigException) {
            return "config_error";
        }
        return "dependency_error";
    }

    private void countTick(String outcome) {
        meterRegistry.counter("billing.ticks", "outcome", outcome).increment();
    }
}
