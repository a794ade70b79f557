package oikosnomos.billing.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single power reading reported by a device of a home.
 * energyWh is the energy attributed to this sample; when absent, power is
 * integrated over the nominal sampling interval.
 */
@Value
@Builder
public class Reading {
    Instant timestamp;
    String homeId;
    String deviceCategory;
    double powerW;
    Double energyWh;
}
