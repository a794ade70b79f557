package oikosnomos.billing.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Raw shape of the tariffs.structure JSON column, before validation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TariffStructureDTO {

    @JsonProperty("fixed_charge_monthly")
    private BigDecimal fixedChargeMonthly;

    @JsonProperty("energy_charges")
    private List<EnergyChargeDTO> energyCharges;

    @JsonProperty("tou_schedule")
    private TouScheduleDTO touSchedule;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnergyChargeDTO {
        private Integer tier;

        @JsonProperty("limit_kwh")
        private BigDecimal limitKwh;

        // period key (off_peak, partial_peak, peak) -> $/kWh
        private Map<String, BigDecimal> summer;
        private Map<String, BigDecimal> winter;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TouScheduleDTO {
        @JsonProperty("summer_months")
        private List<Integer> summerMonths;

        @JsonProperty("peak_hours")
        private List<Integer> peakHours;

        @JsonProperty("partial_peak_hours")
        private List<Integer> partialPeakHours;

        @JsonProperty("off_peak_hours")
        private List<Integer> offPeakHours;
    }
}
