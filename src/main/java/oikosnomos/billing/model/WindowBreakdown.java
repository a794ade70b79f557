package oikosnomos.billing.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Energy of a window split into chronological TOU buckets.
 */
@Value
public class WindowBreakdown {
    Instant start;
    Instant end;
    List<EnergyBucket> buckets;

    public BigDecimal totalKwh() {
        return buckets.stream()
                .map(EnergyBucket::getKwh)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Map<TouPeriod, BigDecimal> kwhByPeriod() {
        Map<TouPeriod, BigDecimal> totals = new EnumMap<>(TouPeriod.class);
        for (TouPeriod period : TouPeriod.values()) {
            totals.put(period, BigDecimal.ZERO);
        }
        for (EnergyBucket bucket : buckets) {
            totals.merge(bucket.getPeriod(), bucket.getKwh(), BigDecimal::add);
        }
        return totals;
    }
}
