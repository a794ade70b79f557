package oikosnomos.billing.service;

import oikosnomos.billing.model.Reading;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory readings of one home, per device category. The lock is only held
 * for in-memory append, eviction and scans.
 */
final class HomeReadings {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ArrayDeque<Reading>> byCategory = new HashMap<>();

    void append(Reading reading, Instant cutoff) {
        lock.lock();
        try {
            byCategory.computeIfAbsent(reading.getDeviceCategory(), c -> new ArrayDeque<>()).addLast(reading);
            evictBefore(cutoff);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Energy per local clock hour for readings with from <= timestamp <= to that are
     * not older than cutoff.
     */
    SortedMap<Instant, BigDecimal> hourlyKwh(Instant from, Instant to, Instant cutoff, ZoneId zone,
                                             Function<Reading, BigDecimal> kwhOf) {
        Instant effectiveFrom = from.isBefore(cutoff) ? cutoff : from;
        SortedMap<Instant, BigDecimal> hourly = new TreeMap<>();
        lock.lock();
        try {
            evictBefore(cutoff);
            for (ArrayDeque<Reading> readings : byCategory.values()) {
                for (Reading reading : readings) {
                    Instant ts = reading.getTimestamp();
                    if (ts.isBefore(effectiveFrom) || ts.isAfter(to)) {
                        continue;
                    }
                    Instant hour = ts.atZone(zone).truncatedTo(ChronoUnit.HOURS).toInstant();
                    hourly.merge(hour, kwhOf.apply(reading), BigDecimal::add);
                }
            }
        } finally {
            lock.unlock();
        }
        return hourly;
    }

    int size() {
        lock.lock();
        try {
            return byCategory.values().stream().mapToInt(ArrayDeque::size).sum();
        } finally {
            lock.unlock();
        }
    }

    // Readings mostly arrive in time order. A late reading stays behind newer ones
    // until they expire; scans still filter it by cutoff.
    private void evictBefore(Instant cutoff) {
        for (ArrayDeque<Reading> readings : byCategory.values()) {
            while (!readings.isEmpty() && readings.peekFirst().getTimestamp().isBefore(cutoff)) {
                readings.pollFirst();
            }
        }
    }
}
