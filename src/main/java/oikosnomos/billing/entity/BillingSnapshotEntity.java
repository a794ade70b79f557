package oikosnomos.billing.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import oikosnomos.billing.model.BillingSnapshot;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persisted billing snapshot, one row per tick per home. Keyed by (home_id, timestamp)
 * so a retried save of the same snapshot does not create a second row.
 */
@Entity
@Table(name = "billing_snapshots",
       indexes = {
           @Index(name = "idx_billing_home", columnList = "home_id, timestamp")
       })
@IdClass(BillingSnapshotEntity.Key.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingSnapshotEntity {

    @Id
    @Column(name = "home_id", nullable = false)
    private String homeId;

    @Id
    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "cost_today", nullable = false, precision = 14, scale = 4)
    private BigDecimal costToday;

    @Column(name = "energy_today_kwh", nullable = false, precision = 14, scale = 4)
    private BigDecimal energyTodayKwh;

    @Column(name = "projected_month", precision = 14, scale = 4)
    private BigDecimal projectedMonth;

    @Column(name = "co2_today_kg", precision = 14, scale = 4)
    private BigDecimal co2TodayKg;

    @Column(name = "current_rate", precision = 10, scale = 4)
    private BigDecimal currentRate;

    @Column(name = "tariff_id")
    private Long tariffId;

    public static BillingSnapshotEntity from(BillingSnapshot snapshot) {
        return BillingSnapshotEntity.builder()
                .homeId(snapshot.getHomeId())
                .timestamp(snapshot.getTimestamp())
                .costToday(snapshot.getCostToday())
                .energyTodayKwh(snapshot.getEnergyTodayKwh())
                .projectedMonth(snapshot.getProjectedMonth())
                .co2TodayKg(snapshot.getCo2TodayKg())
                .currentRate(snapshot.getCurrentRate())
                .tariffId(snapshot.getTariffId())
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String homeId;
        private Instant timestamp;
    }
}
