package oikosnomos.billing.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import oikosnomos.billing.model.BillingSnapshot;

/**
 * Event published when a billing tick produced a snapshot for a home.
 * The transport publisher and the snapshot store listen to it independently,
 * so a failure of one never blocks the other.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingSnapshotComputedEvent {

    /**
     * Home the snapshot belongs to.
     */
    private String homeId;

    /**
     * The computed snapshot.
     */
    private BillingSnapshot snapshot;
}
