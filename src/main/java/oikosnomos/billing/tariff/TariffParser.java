package oikosnomos.billing.tariff;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import oikosnomos.billing.dto.TariffStructureDTO;
import oikosnomos.billing.dto.TariffStructureDTO.EnergyChargeDTO;
import oikosnomos.billing.dto.TariffStructureDTO.TouScheduleDTO;
import oikosnomos.billing.entity.Tariff;
import oikosnomos.billing.exception.TariffConfigException;
import oikosnomos.billing.model.Season;
import oikosnomos.billing.model.TariffDefinition;
import oikosnomos.billing.model.Tier;
import oikosnomos.billing.model.TouPeriod;
import oikosnomos.billing.model.TouSchedule;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Maps a tariffs row onto a validated TariffDefinition.
 *
 * Rejected with TariffConfigException:
 * - peak, partial-peak and (if listed) off-peak hours that do not partition 0..23
 * - tiers not strictly ascending by limit, or an unbounded tier that is not last
 * - a tier missing a season/period rate
 */
@Component
@RequiredArgsConstructor
public class TariffParser {

    static final BigDecimal DEFAULT_CO2_FACTOR = new BigDecimal("0.42");

    private final ObjectMapper objectMapper;

    public TariffDefinition parse(Tariff row) {
        if (row.getStructure() == null || row.getStructure().isBlank()) {
            throw new TariffConfigException("Tariff " + row.getName() + " has no structure");
        }
        TariffStructureDTO structure;
        try {
            structure = objectMapper.readValue(row.getStructure(), TariffStructureDTO.class);
        } catch (JsonProcessingException e) {
            throw new TariffConfigException(
                    "Tariff " + row.getName() + " structure is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return toDefinition(row, structure);
    }

    TariffDefinition toDefinition(Tariff row, TariffStructureDTO structure) {
        String name = row.getName();
        BigDecimal fixedCharge = structure.getFixedChargeMonthly() != null
                ? structure.getFixedChargeMonthly()
                : BigDecimal.ZERO;
        if (fixedCharge.signum() < 0) {
            throw new TariffConfigException("Tariff " + name + " has a negative fixed_charge_monthly");
        }

        return TariffDefinition.builder()
                .id(row.getId())
                .name(name)
                .utility(row.getUtility())
                .fixedChargeMonthly(fixedCharge)
                .tiers(parseTiers(name, structure.getEnergyCharges()))
                .schedule(parseSchedule(name, structure.getTouSchedule()))
                .co2FactorKgPerKwh(row.getCo2FactorKgPerKwh() != null
                        ? row.getCo2FactorKgPerKwh()
                        : DEFAULT_CO2_FACTOR)
                .effectiveDate(row.getEffectiveDate())
                .endDate(row.getEndDate())
                .build();
    }

    TouSchedule parseSchedule(String name, TouScheduleDTO dto) {
        if (dto == null) {
            throw new TariffConfigException("Tariff " + name + " has no tou_schedule");
        }

        Set<Integer> summerMonths = new TreeSet<>();
        if (dto.getSummerMonths() != null) {
            for (Integer month : dto.getSummerMonths()) {
                if (month == null || month < 1 || month > 12) {
                    throw new TariffConfigException("Tariff " + name + " has invalid summer month " + month);
                }
                summerMonths.add(month);
            }
        }

        Set<Integer> peak = hourSet(name, "peak_hours", dto.getPeakHours());
        Set<Integer> partialPeak = hourSet(name, "partial_peak_hours", dto.getPartialPeakHours());

        Set<Integer> overlap = new TreeSet<>(peak);
        overlap.retainAll(partialPeak);
        if (!overlap.isEmpty()) {
            throw new TariffConfigException(
                    "Tariff " + name + " lists hours " + overlap + " as both peak and partial peak");
        }

        if (dto.getOffPeakHours() != null) {
            Set<Integer> offPeak = hourSet(name, "off_peak_hours", dto.getOffPeakHours());
            Set<Integer> complement = IntStream.range(0, 24).boxed()
                    .filter(h -> !peak.contains(h) && !partialPeak.contains(h))
                    .collect(Collectors.toCollection(TreeSet::new));
            if (!offPeak.equals(complement)) {
                Set<Integer> gaps = new TreeSet<>(complement);
                gaps.removeAll(offPeak);
                Set<Integer> overlaps = new TreeSet<>(offPeak);
                overlaps.removeAll(complement);
                throw new TariffConfigException("Tariff " + name + " TOU hours do not partition the day"
                        + " (uncovered " + gaps + ", overlapping " + overlaps + ")");
            }
        }

        return TouSchedule.builder()
                .summerMonths(Collections.unmodifiableSet(summerMonths))
                .peakHours(Collections.unmodifiableSet(peak))
                .partialPeakHours(Collections.unmodifiableSet(partialPeak))
                .build();
    }

    private Set<Integer> hourSet(String name, String field, List<Integer> hours) {
        Set<Integer> result = new TreeSet<>();
        if (hours == null) {
            return result;
        }
        for (Integer hour : hours) {
            if (hour == null || hour < 0 || hour > 23) {
                throw new TariffConfigException("Tariff " + name + " " + field + " contains invalid hour " + hour);
            }
            if (!result.add(hour)) {
                throw new TariffConfigException("Tariff " + name + " " + field + " lists hour " + hour + " twice");
            }
        }
        return result;
    }

    List<Tier> parseTiers(String name, List<EnergyChargeDTO> charges) {
        if (charges == null || charges.isEmpty()) {
            throw new TariffConfigException("Tariff " + name + " has no energy_charges");
        }

        List<Tier> tiers = new ArrayList<>();
        BigDecimal previousLimit = null;
        for (int i = 0; i < charges.size(); i++) {
            EnergyChargeDTO charge = charges.get(i);
            int number = charge.getTier() != null ? charge.getTier() : i + 1;
            BigDecimal limit = charge.getLimitKwh();
            boolean last = i == charges.size() - 1;

            if (limit == null && !last) {
                throw new TariffConfigException(
                        "Tariff " + name + " tier " + number + " is unbounded but is not the last tier");
            }
            if (limit != null) {
                if (limit.signum() <= 0) {
                    throw new TariffConfigException("Tariff " + name + " tier " + number + " has a non-positive limit");
                }
                if (previousLimit != null && limit.compareTo(previousLimit) <= 0) {
                    throw new TariffConfigException("Tariff " + name + " tiers are not in ascending limit order"
                            + " (tier " + number + " limit " + limit + " <= " + previousLimit + ")");
                }
                previousLimit = limit;
            }

            Map<Season, Map<TouPeriod, BigDecimal>> rates = new EnumMap<>(Season.class);
            rates.put(Season.SUMMER, rateTable(name, number, Season.SUMMER, charge.getSummer()));
            rates.put(Season.WINTER, rateTable(name, number, Season.WINTER, charge.getWinter()));

            tiers.add(Tier.builder()
                    .number(number)
                    .limitKwh(limit)
                    .rates(Collections.unmodifiableMap(rates))
                    .build());
        }
        return List.copyOf(tiers);
    }

    private Map<TouPeriod, BigDecimal> rateTable(String name, int tier, Season season, Map<String, BigDecimal> raw) {
        if (raw == null) {
            throw new TariffConfigException(
                    "Tariff " + name + " tier " + tier + " has no " + season.key() + " rates");
        }
        Map<TouPeriod, BigDecimal> table = new EnumMap<>(TouPeriod.class);
        for (TouPeriod period : TouPeriod.values()) {
            BigDecimal rate = raw.get(period.key());
            if (rate == null) {
                throw new TariffConfigException("Tariff " + name + " tier " + tier + " has no "
                        + season.key() + " " + period.key() + " rate");
            }
            if (rate.signum() < 0) {
                throw new TariffConfigException("Tariff " + name + " tier " + tier + " has a negative "
                        + season.key() + " " + period.key() + " rate");
            }
            table.put(period, rate);
        }
        return Collections.unmodifiableMap(table);
    }
}
