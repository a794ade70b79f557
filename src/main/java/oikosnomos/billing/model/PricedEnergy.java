package oikosnomos.billing.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Price of an energy quantity, split into one portion per tier it crossed.
 */
@Value
@Builder
public class PricedEnergy {
    @Singular
    List<Portion> portions;
    BigDecimal cost;
    BigDecimal monthToDateAfterKwh;
    RateResolution lastResolution;

    @Value
    public static class Portion {
        BigDecimal kwh;
        RateResolution resolution;

        public BigDecimal cost() {
            return kwh.multiply(resolution.getRate());
        }
    }
}
