package oikosnomos.billing.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One consumption tier of a tariff. A null limit means the tier is unbounded.
 */
@Value
@Builder
public class Tier {
    int number;
    BigDecimal limitKwh;
    Map<Season, Map<TouPeriod, BigDecimal>> rates;

    public boolean isUnbounded() {
        return limitKwh == null;
    }

    /** True when the tier still applies at the given month-to-date consumption. */
    public boolean appliesAt(BigDecimal monthToDateKwh) {
        return limitKwh == null || limitKwh.compareTo(monthToDateKwh) > 0;
    }

    public BigDecimal rate(Season season, TouPeriod period) {
        return rates.get(season).get(period);
    }
}
