package oikosnomos.billing.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZoneId;

/**
 * A monitored home. Its timezone defines the local day and month used for billing.
 */
@Entity
@Table(name = "homes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Home {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "location_id")
    private String locationId;

    @Column(name = "timezone")
    private String timezone;

    @Column(name = "active_tariff_id")
    private Long activeTariffId;

    public ZoneId zone() {
        return timezone == null || timezone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(timezone);
    }
}
