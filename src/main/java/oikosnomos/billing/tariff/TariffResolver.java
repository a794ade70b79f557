package oikosnomos.billing.tariff;

import oikosnomos.billing.model.PricedEnergy;
import oikosnomos.billing.model.RateResolution;
import oikosnomos.billing.model.Season;
import oikosnomos.billing.model.TariffDefinition;
import oikosnomos.billing.model.Tier;
import oikosnomos.billing.model.TouPeriod;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.ZonedDateTime;

/**
 * Stateless rate lookup: season x TOU period x consumption tier.
 */
@Component
public class TariffResolver {

    /**
     * Rate in effect at a local instant for a home whose consumption so far this
     * month is monthToDateKwh. The first tier whose limit exceeds month-to-date
     * (or that is unbounded) applies. Past the limit of a bounded last tier,
     * the last tier keeps applying.
     */
    public RateResolution resolve(ZonedDateTime localTime, TariffDefinition tariff, BigDecimal monthToDateKwh) {
        return toResolution(localTime, tariff, selectTier(tariff, monthToDateKwh));
    }

    /**
     * Prices kwh consumed at localTime. When month-to-date crosses a tier limit
     * inside the quantity, the quantity is split at the limit and each portion is
     * priced at its own tier.
     */
    public PricedEnergy price(ZonedDateTime localTime, TariffDefinition tariff,
                              BigDecimal monthToDateKwh, BigDecimal kwh) {
        if (kwh.signum() < 0) {
            throw new IllegalArgumentException("Energy to price must not be negative: " + kwh);
        }

        PricedEnergy.PricedEnergyBuilder priced = PricedEnergy.builder();
        BigDecimal running = monthToDateKwh;
        BigDecimal remaining = kwh;
        BigDecimal cost = BigDecimal.ZERO;
        RateResolution resolution = resolve(localTime, tariff, running);

        while (remaining.signum() > 0) {
            Tier tier = selectTier(tariff, running);
            resolution = toResolution(localTime, tariff, tier);
            BigDecimal kwhAtTier = tier.isUnbounded() || isLast(tariff, tier)
                    ? remaining
                    : remaining.min(tier.getLimitKwh().subtract(running));

            PricedEnergy.Portion portion = new PricedEnergy.Portion(kwhAtTier, resolution);
            priced.portion(portion);
            cost = cost.add(portion.cost());
            running = running.add(kwhAtTier);
            remaining = remaining.subtract(kwhAtTier);
        }

        return priced
                .cost(cost)
                .monthToDateAfterKwh(running)
                .lastResolution(resolution)
                .build();
    }

    private Tier selectTier(TariffDefinition tariff, BigDecimal monthToDateKwh) {
        for (Tier tier : tariff.getTiers()) {
            if (tier.appliesAt(monthToDateKwh)) {
                return tier;
            }
        }
        return tariff.getTiers().get(tariff.getTiers().size() - 1);
    }

    private static boolean isLast(TariffDefinition tariff, Tier tier) {
        return tier == tariff.getTiers().get(tariff.getTiers().size() - 1);
    }

    private RateResolution toResolution(ZonedDateTime localTime, TariffDefinition tariff, Tier tier) {
        Season season = tariff.getSchedule().seasonOf(localTime.getMonthValue());
        TouPeriod period = tariff.getSchedule().periodAt(localTime.getHour());
        return new RateResolution(tier.rate(season, period), tier.getNumber(), period, season);
    }
}
