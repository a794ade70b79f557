package oikosnomos.billing.tariff;

import com.fasterxml.jackson.databind.ObjectMapper;
import oikosnomos.billing.entity.Tariff;
import oikosnomos.billing.exception.TariffConfigException;
import oikosnomos.billing.model.PricedEnergy;
import oikosnomos.billing.model.Season;
import oikosnomos.billing.model.TariffDefinition;
import oikosnomos.billing.model.TouPeriod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class TariffParserTest {

    private TariffParser parser;

    @BeforeEach
    void setUp() {
        parser = new TariffParser(new ObjectMapper());
    }

    @Test
    void parse_pgeE6_buildsTiersAndSchedule() {
        TariffDefinition tariff = parser.parse(TestTariffs.pgeE6Row());

        assertEquals("pge_e6_2025", tariff.getName());
        assertEquals(0, new BigDecimal("10.0").compareTo(tariff.getFixedChargeMonthly()));
        assertEquals(2, tariff.getTiers().size());
        assertEquals(0, new BigDecimal("400").compareTo(tariff.getTiers().get(0).getLimitKwh()));
        assertTrue(tariff.getTiers().get(1).isUnbounded());
        assertEquals(0, new BigDecimal("0.45").compareTo(
                tariff.getTiers().get(0).rate(Season.SUMMER, TouPeriod.PEAK)));
        assertEquals(0, new BigDecimal("0.33").compareTo(
                tariff.getTiers().get(1).rate(Season.WINTER, TouPeriod.OFF_PEAK)));

        assertEquals(Season.SUMMER, tariff.getSchedule().seasonOf(7));
        assertEquals(Season.WINTER, tariff.getSchedule().seasonOf(12));
        assertEquals(TouPeriod.PEAK, tariff.getSchedule().periodAt(16));
        assertEquals(TouPeriod.PARTIAL_PEAK, tariff.getSchedule().periodAt(22));
        assertEquals(TouPeriod.OFF_PEAK, tariff.getSchedule().periodAt(23));
    }

    @Test
    void parse_missingCo2Factor_defaultsTo042() {
        Tariff row = TestTariffs.pgeE6Row();
        row.setCo2FactorKgPerKwh(null);

        TariffDefinition tariff = parser.parse(row);

        assertEquals(0, new BigDecimal("0.42").compareTo(tariff.getCo2FactorKgPerKwh()));
    }

    @Test
    void parse_invalidJson_isConfigError() {
        Tariff row = TestTariffs.pgeE6Row();
        row.setStructure("{ not json");

        assertThrows(TariffConfigException.class, () -> parser.parse(row));
    }

    @Test
    void parse_overlappingPeakAndPartialPeak_isRejected() {
        Tariff row = withSchedule("""
                "tou_schedule": {"summer_months": [7], "peak_hours": [16, 17], "partial_peak_hours": [17, 18]}
                """);

        TariffConfigException ex = assertThrows(TariffConfigException.class, () -> parser.parse(row));
        assertTrue(ex.getMessage().contains("[17]"));
    }

    @Test
    void parse_offPeakHoursLeavingGap_isRejected() {
        Tariff row = withSchedule("""
                "tou_schedule": {"summer_months": [7], "peak_hours": [16], "partial_peak_hours": [15],
                                 "off_peak_hours": [0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 17, 18, 19, 20, 21, 22]}
                """);

        TariffConfigException ex = assertThrows(TariffConfigException.class, () -> parser.parse(row));
        assertTrue(ex.getMessage().contains("uncovered [23]"));
    }

    @Test
    void parse_hourOutOfRange_isRejected() {
        Tariff row = withSchedule("""
                "tou_schedule": {"summer_months": [7], "peak_hours": [24], "partial_peak_hours": []}
                """);

        assertThrows(TariffConfigException.class, () -> parser.parse(row));
    }

    @Test
    void parse_unboundedTierBeforeLast_isRejected() {
        Tariff row = TestTariffs.pgeE6Row();
        row.setStructure("""
                {"energy_charges": [
                   {"tier": 1, "limit_kwh": null, "summer": %s, "winter": %s},
                   {"tier": 2, "limit_kwh": 400, "summer": %s, "winter": %s}],
                 "tou_schedule": {"summer_months": [7], "peak_hours": [16], "partial_peak_hours": [15]}}
                """.formatted(RATES, RATES, RATES, RATES));

        TariffConfigException ex = assertThrows(TariffConfigException.class, () -> parser.parse(row));
        assertTrue(ex.getMessage().contains("unbounded"));
    }

    @Test
    void parse_descendingLimits_isRejected() {
        Tariff row = TestTariffs.pgeE6Row();
        row.setStructure("""
                {"energy_charges": [
                   {"tier": 1, "limit_kwh": 400, "summer": %s, "winter": %s},
                   {"tier": 2, "limit_kwh": 300, "summer": %s, "winter": %s}],
                 "tou_schedule": {"summer_months": [7], "peak_hours": [16], "partial_peak_hours": [15]}}
                """.formatted(RATES, RATES, RATES, RATES));

        TariffConfigException ex = assertThrows(TariffConfigException.class, () -> parser.parse(row));
        assertTrue(ex.getMessage().contains("ascending"));
    }

    @Test
    void parse_boundedLastTier_isAcceptedAndPricedPastItsLimit() {
        Tariff row = TestTariffs.pgeE6Row();
        row.setStructure("""
                {"energy_charges": [
                   {"tier": 1, "limit_kwh": 100, "summer": %s, "winter": %s},
                   {"tier": 2, "limit_kwh": 200, "summer": %s, "winter": %s}],
                 "tou_schedule": {"summer_months": [7], "peak_hours": [16], "partial_peak_hours": [15]}}
                """.formatted(RATES, RATES, RATES, RATES));

        TariffDefinition tariff = parser.parse(row);
        PricedEnergy priced = new TariffResolver().price(
                ZonedDateTime.of(2025, 7, 15, 16, 0, 0, 0, ZoneOffset.UTC), tariff,
                new BigDecimal("199"), new BigDecimal("2"));

        assertEquals(0, new BigDecimal("0.8").compareTo(priced.getCost()));
        assertEquals(2, priced.getLastResolution().getTier());
    }

    @Test
    void parse_missingPeriodRate_isRejected() {
        Tariff row = TestTariffs.pgeE6Row();
        row.setStructure("""
                {"energy_charges": [
                   {"tier": 1, "limit_kwh": null, "summer": {"off_peak": 0.2, "peak": 0.4}, "winter": %s}],
                 "tou_schedule": {"summer_months": [7], "peak_hours": [16], "partial_peak_hours": [15]}}
                """.formatted(RATES));

        TariffConfigException ex = assertThrows(TariffConfigException.class, () -> parser.parse(row));
        assertTrue(ex.getMessage().contains("summer partial_peak"));
    }

    @Test
    void isActiveOn_endDateIsExclusive() {
        Tariff row = TestTariffs.pgeE6Row();
        row.setEndDate(LocalDate.of(2026, 1, 1));

        TariffDefinition tariff = parser.parse(row);

        assertFalse(tariff.isActiveOn(LocalDate.of(2024, 12, 31)));
        assertTrue(tariff.isActiveOn(LocalDate.of(2025, 1, 1)));
        assertTrue(tariff.isActiveOn(LocalDate.of(2025, 12, 31)));
        assertFalse(tariff.isActiveOn(LocalDate.of(2026, 1, 1)));
    }

    private static final String RATES = "{\"off_peak\": 0.2, \"partial_peak\": 0.3, \"peak\": 0.4}";

    private static Tariff withSchedule(String scheduleField) {
        Tariff row = TestTariffs.pgeE6Row();
        row.setStructure("""
                {"energy_charges": [{"tier": 1, "limit_kwh": null, "summer": %s, "winter": %s}],
                 %s}
                """.formatted(RATES, RATES, scheduleField));
        return row;
    }
}
