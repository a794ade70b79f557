package oikosnomos.billing.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Immutable billing result of one tick for one home.
 */
@Value
@Builder
public class BillingSnapshot {
    Instant timestamp;
    String homeId;
    /** Local billing day of the home at timestamp. */
    LocalDate localDate;
    BigDecimal costToday;
    BigDecimal energyTodayKwh;
    BigDecimal projectedMonth;
    BigDecimal co2TodayKg;
    BigDecimal currentRate;
    Long tariffId;
    String tariffName;
    BigDecimal fixedChargeMonthly;
}
