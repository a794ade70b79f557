package oikosnomos.billing.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Effective rate for an instant at a given month-to-date consumption.
 */
@Value
public class RateResolution {
    BigDecimal rate;
    int tier;
    TouPeriod period;
    Season season;
}
