package oikosnomos.billing.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Validated, immutable tariff. Tiers are sorted by ascending limit with the
 * unbounded tier, if any, last.
 */
@Value
@Builder
public class TariffDefinition {
    Long id;
    String name;
    String utility;
    BigDecimal fixedChargeMonthly;
    List<Tier> tiers;
    TouSchedule schedule;
    BigDecimal co2FactorKgPerKwh;
    LocalDate effectiveDate;
    LocalDate endDate;

    /** Effective from effectiveDate (inclusive) until endDate (exclusive). */
    public boolean isActiveOn(LocalDate date) {
        if (effectiveDate != null && date.isBefore(effectiveDate)) {
            return false;
        }
        return endDate == null || date.isBefore(endDate);
    }
}
