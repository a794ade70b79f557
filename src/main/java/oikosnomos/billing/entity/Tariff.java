package oikosnomos.billing.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Utility tariff row. Rows are never edited once effective; a change is a new
 * effective-dated row. The engine only reads them.
 */
@Entity
@Immutable
@Table(name = "tariffs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tariff {

    @Id
    @Column(name = "id")
    private Long id;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    @Column(name = "utility", nullable = false)
    private String utility;

    // JSON: fixed_charge_monthly, energy_charges, tou_schedule
    @Column(name = "structure", nullable = false, columnDefinition = "jsonb")
    private String structure;

    @Column(name = "effective_date", nullable = false)
    private LocalDate effectiveDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "co2_factor_kg_per_kwh")
    private BigDecimal co2FactorKgPerKwh;
}
