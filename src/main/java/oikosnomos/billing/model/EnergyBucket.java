package oikosnomos.billing.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Energy consumed in a run of consecutive clock hours sharing one TOU period.
 */
@Value
public class EnergyBucket {
    Instant start;
    Instant end;
    TouPeriod period;
    BigDecimal kwh;
}
