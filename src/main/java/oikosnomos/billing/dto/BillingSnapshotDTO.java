package oikosnomos.billing.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import oikosnomos.billing.entity.BillingSnapshotEntity;
import oikosnomos.billing.model.BillingSnapshot;

import java.math.BigDecimal;

/**
 * Wire shape of a billing snapshot. The outbound transport message carries only the
 * core fields; the status API adds the home and tariff fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BillingSnapshotDTO {

    @Schema(description = "Snapshot time (RFC3339)", example = "2025-07-15T17:05:00Z")
    private String timestamp;

    @JsonProperty("home_id")
    private String homeId;

    @JsonProperty("cost_today")
    private BigDecimal costToday;

    @JsonProperty("energy_today_kwh")
    private BigDecimal energyTodayKwh;

    @JsonProperty("projected_month")
    private BigDecimal projectedMonth;

    @JsonProperty("co2_today_kg")
    private BigDecimal co2TodayKg;

    @JsonProperty("current_rate")
    private BigDecimal currentRate;

    @JsonProperty("tariff_id")
    private Long tariffId;

    @Schema(description = "Tariff name")
    private String tariff;

    @JsonProperty("fixed_charge_monthly")
    private BigDecimal fixedChargeMonthly;

    /** Payload published to home/{home_id}/billing/today_cost. */
    public static BillingSnapshotDTO message(BillingSnapshot snapshot) {
        return BillingSnapshotDTO.builder()
                .timestamp(snapshot.getTimestamp().toString())
                .costToday(snapshot.getCostToday())
                .energyTodayKwh(snapshot.getEnergyTodayKwh())
                .projectedMonth(snapshot.getProjectedMonth())
                .co2TodayKg(snapshot.getCo2TodayKg())
                .currentRate(snapshot.getCurrentRate())
                .build();
    }

    public static BillingSnapshotDTO current(BillingSnapshot snapshot) {
        return BillingSnapshotDTO.builder()
                .timestamp(snapshot.getTimestamp().toString())
                .homeId(snapshot.getHomeId())
                .costToday(snapshot.getCostToday())
                .energyTodayKwh(snapshot.getEnergyTodayKwh())
                .projectedMonth(snapshot.getProjectedMonth())
                .co2TodayKg(snapshot.getCo2TodayKg())
                .currentRate(snapshot.getCurrentRate())
                .tariffId(snapshot.getTariffId())
                .tariff(snapshot.getTariffName())
                .fixedChargeMonthly(snapshot.getFixedChargeMonthly())
                .build();
    }

    public static BillingSnapshotDTO history(BillingSnapshotEntity row) {
        return BillingSnapshotDTO.builder()
                .timestamp(row.getTimestamp().toString())
                .homeId(row.getHomeId())
                .costToday(row.getCostToday())
                .energyTodayKwh(row.getEnergyTodayKwh())
                .projectedMonth(row.getProjectedMonth())
                .co2TodayKg(row.getCo2TodayKg())
                .currentRate(row.getCurrentRate())
                .tariffId(row.getTariffId())
                .build();
    }
}
