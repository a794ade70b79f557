package oikosnomos.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.config.BillingProperties;
import oikosnomos.billing.entity.Home;
import oikosnomos.billing.exception.DependencyException;
import oikosnomos.billing.exception.TariffConfigException;
import oikosnomos.billing.exception.TariffLookupException;
import oikosnomos.billing.model.BillingSnapshot;
import oikosnomos.billing.model.EnergyBucket;
import oikosnomos.billing.model.PricedEnergy;
import oikosnomos.billing.model.TariffDefinition;
import oikosnomos.billing.model.WindowBreakdown;
import oikosnomos.billing.repository.RawReadingRepository;
import oikosnomos.billing.tariff.TariffCatalog;
import oikosnomos.billing.tariff.TariffResolver;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prices today's energy of a home against its tariff.
 *
 * Flow:
 * 1. Break today's energy (local midnight to now) into chronological TOU buckets
 * 2. Take month-to-date consumption before today from the durable store
 * 3. Price each bucket, advancing month-to-date so tier crossings are prorated
 * 4. Extrapolate the month and derive CO2 from today's energy
 *
 * A failure anywhere aborts the computation; no partial snapshot is produced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingCalculator {

    private static final int SCALE = 4;

    private final HomeService homeService;
    private final TariffCatalog tariffCatalog;
    private final TariffResolver tariffResolver;
    private final EnergyAccumulator energyAccumulator;
    private final RawReadingRepository rawReadingRepository;
    private final BillingProperties properties;

    private final Map<String, BillingSnapshot> latest = new ConcurrentHashMap<>();

    /**
     * @throws DependencyException when the home, its tariff or the store cannot be used
     */
    public BillingSnapshot compute(String homeId, Instant now) {
        BillingSnapshot snapshot;
        try {
            snapshot = doCompute(homeId, now);
        } catch (TariffLookupException | TariffConfigException e) {
            throw new DependencyException("Billing for home " + homeId + " aborted: " + e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new DependencyException("Store unavailable while billing home " + homeId, e);
        }
        latest.put(homeId, snapshot);
        return snapshot;
    }

    /** Most recent successfully computed snapshot of a home. */
    public Optional<BillingSnapshot> latest(String homeId) {
        return Optional.ofNullable(latest.get(homeId));
    }

    private BillingSnapshot doCompute(String homeId, Instant now) {
        Home home = homeService.requireHome(homeId);
        ZoneId zone = home.zone();
        ZonedDateTime localNow = now.atZone(zone);
        LocalDate today = localNow.toLocalDate();
        Instant dayStart = today.atStartOfDay(zone).toInstant();
        Instant monthStart = today.withDayOfMonth(1).atStartOfDay(zone).toInstant();

        TariffDefinition tariff = tariffCatalog.activeTariff(home, now);
        WindowBreakdown breakdown = energyAccumulator.getWindowBreakdown(
                homeId, dayStart, now, zone, tariff.getSchedule());

        // up to local midnight only: today's energy comes from the breakdown
        BigDecimal monthToDate = rawReadingRepository.sumEnergyKwh(
                homeId, monthStart, dayStart, properties.getSamplingInterval());

        BigDecimal running = monthToDate;
        BigDecimal cost = BigDecimal.ZERO;
        for (EnergyBucket bucket : breakdown.getBuckets()) {
            PricedEnergy priced = tariffResolver.price(
                    bucket.getStart().atZone(zone), tariff, running, bucket.getKwh());
            cost = cost.add(priced.getCost());
            running = priced.getMonthToDateAfterKwh();
            log.debug("Home {} bucket {}..{} {}: {} kWh -> {} over {} tier portion(s)", homeId,
                    bucket.getStart(), bucket.getEnd(), bucket.getPeriod(), bucket.getKwh(),
                    priced.getCost(), priced.getPortions().size());
        }

        BigDecimal currentRate = tariffResolver.resolve(localNow, tariff, running).getRate();
        BigDecimal energyToday = breakdown.totalKwh();

        // Linear extrapolation assuming uniform daily usage
        int daysElapsed = localNow.getDayOfMonth();
        int daysInMonth = YearMonth.from(localNow).lengthOfMonth();
        BigDecimal projectedMonth = cost.multiply(BigDecimal.valueOf(daysInMonth))
                .divide(BigDecimal.valueOf(daysElapsed), SCALE, RoundingMode.HALF_UP);

        BigDecimal co2Today = energyToday.multiply(tariff.getCo2FactorKgPerKwh());

        return BillingSnapshot.builder()
                .timestamp(now)
                .homeId(homeId)
                .localDate(today)
                .costToday(cost.setScale(SCALE, RoundingMode.HALF_UP))
                .energyTodayKwh(energyToday.setScale(SCALE, RoundingMode.HALF_UP))
                .projectedMonth(projectedMonth)
                .co2TodayKg(co2Today.setScale(SCALE, RoundingMode.HALF_UP))
                .currentRate(currentRate)
                .tariffId(tariff.getId())
                .tariffName(tariff.getName())
                .fixedChargeMonthly(tariff.getFixedChargeMonthly())
                .build();
    }
}
