package oikosnomos.billing.service;

import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.config.BillingProperties;
import oikosnomos.billing.exception.ReadingValidationException;
import oikosnomos.billing.model.EnergyBucket;
import oikosnomos.billing.model.Reading;
import oikosnomos.billing.model.TouPeriod;
import oikosnomos.billing.model.TouSchedule;
import oikosnomos.billing.model.WindowBreakdown;
import oikosnomos.billing.repository.RawReadingRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling per-home store of readings over the retention window.
 *
 * Homes are sharded: each has its own lock, so ingest for different homes never
 * contends. Raw readings are persisted through the bounded persistence pool after
 * the in-memory append, never while a home lock is held.
 */
@Service
@Slf4j
public class EnergyAccumulator {

    // W x ms -> kWh
    private static final BigDecimal WATT_MILLIS_PER_KWH = BigDecimal.valueOf(3_600_000_000L);
    private static final Duration ONE_HOUR = Duration.ofHours(1);

    private final BillingProperties properties;
    private final Clock clock;
    private final PersistenceDispatcher persistenceDispatcher;
    private final RawReadingRepository rawReadingRepository;
    private final Set<String> knownCategories;

    private final Map<String, HomeReadings> homes = new ConcurrentHashMap<>();

    public EnergyAccumulator(BillingProperties properties,
                             Clock clock,
                             PersistenceDispatcher persistenceDispatcher,
                             RawReadingRepository rawReadingRepository) {
        this.properties = properties;
        this.clock = clock;
        this.persistenceDispatcher = persistenceDispatcher;
        this.rawReadingRepository = rawReadingRepository;
        this.knownCategories = Set.copyOf(properties.getDeviceCategories());
    }

    /**
     * Validates and stores a reading, evicting readings older than the retention window.
     *
     * @throws ReadingValidationException for unknown categories, timestamps too far in the
     *         future or already outside the retention window, and negative power or energy
     */
    public void addReading(Reading reading) {
        Instant now = clock.instant();
        validate(reading, now);

        homes.computeIfAbsent(reading.getHomeId(), id -> new HomeReadings())
                .append(reading, now.minus(properties.getRetention()));
        log.debug("Accepted reading {} {} W at {} for home {}",
                reading.getDeviceCategory(), reading.getPowerW(), reading.getTimestamp(), reading.getHomeId());

        persistenceDispatcher.submit("reading",
                reading.getHomeId() + "/" + reading.getDeviceCategory() + "@" + reading.getTimestamp(),
                () -> rawReadingRepository.insert(reading));
    }

    /**
     * Energy consumed by a home with start <= timestamp <= end, as chronological buckets
     * of consecutive local clock hours sharing one TOU period.
     */
    public WindowBreakdown getWindowBreakdown(String homeId, Instant start, Instant end,
                                              ZoneId zone, TouSchedule schedule) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
        Instant cutoff = clock.instant().minus(properties.getRetention());
        HomeReadings shard = homes.get(homeId);
        SortedMap<Instant, BigDecimal> hourly = shard == null
                ? Collections.emptySortedMap()
                : shard.hourlyKwh(start, end, cutoff, zone, this::energyKwh);

        List<EnergyBucket> buckets = new ArrayList<>();
        Instant bucketStart = null;
        Instant bucketEnd = null;
        TouPeriod bucketPeriod = null;
        BigDecimal bucketKwh = BigDecimal.ZERO;
        for (Map.Entry<Instant, BigDecimal> entry : hourly.entrySet()) {
            Instant hour = entry.getKey();
            TouPeriod period = schedule.periodAt(hour.atZone(zone).getHour());
            if (period == bucketPeriod && hour.equals(bucketEnd)) {
                bucketKwh = bucketKwh.add(entry.getValue());
                bucketEnd = hour.plus(ONE_HOUR);
                continue;
            }
            if (bucketPeriod != null) {
                buckets.add(new EnergyBucket(bucketStart, bucketEnd, bucketPeriod, bucketKwh));
            }
            bucketStart = hour;
            bucketEnd = hour.plus(ONE_HOUR);
            bucketPeriod = period;
            bucketKwh = entry.getValue();
        }
        if (bucketPeriod != null) {
            buckets.add(new EnergyBucket(bucketStart, bucketEnd, bucketPeriod, bucketKwh));
        }
        return new WindowBreakdown(start, end, List.copyOf(buckets));
    }

    /** Readings currently held in memory for a home. */
    public int retainedReadings(String homeId) {
        HomeReadings shard = homes.get(homeId);
        return shard == null ? 0 : shard.size();
    }

    /**
     * energy_wh when reported. Otherwise power_w is assumed constant over one nominal
     * sampling interval, which is an approximation.
     */
    BigDecimal energyKwh(Reading reading) {
        if (reading.getEnergyWh() != null) {
            return BigDecimal.valueOf(reading.getEnergyWh()).movePointLeft(3);
        }
        return BigDecimal.valueOf(reading.getPowerW())
                .multiply(BigDecimal.valueOf(properties.getSamplingInterval().toMillis()))
                .divide(WATT_MILLIS_PER_KWH, MathContext.DECIMAL64);
    }

    private void validate(Reading reading, Instant now) {
        if (reading.getHomeId() == null || reading.getHomeId().isBlank()) {
            throw new ReadingValidationException("missing_home", "Reading has no home id");
        }
        if (reading.getDeviceCategory() == null || !knownCategories.contains(reading.getDeviceCategory())) {
            throw new ReadingValidationException("unknown_category",
                    "Unknown device category '" + reading.getDeviceCategory() + "'");
        }
        Instant ts = reading.getTimestamp();
        if (ts == null) {
            throw new ReadingValidationException("missing_timestamp", "Reading has no timestamp");
        }
        if (ts.isAfter(now.plus(properties.getMaxFutureSkew()))) {
            throw new ReadingValidationException("future_timestamp",
                    "Reading timestamp " + ts + " is too far in the future");
        }
        if (ts.isBefore(now.minus(properties.getRetention()))) {
            throw new ReadingValidationException("expired",
                    "Reading timestamp " + ts + " is outside the retention window");
        }
        if (Double.isNaN(reading.getPowerW()) || Double.isInfinite(reading.getPowerW()) || reading.getPowerW() < 0) {
            throw new ReadingValidationException("negative_power", "Invalid power " + reading.getPowerW() + " W");
        }
        Double energyWh = reading.getEnergyWh();
        if (energyWh != null && (energyWh.isNaN() || energyWh.isInfinite() || energyWh < 0)) {
            throw new ReadingValidationException("negative_energy", "Invalid energy " + energyWh + " Wh");
        }
    }
}
