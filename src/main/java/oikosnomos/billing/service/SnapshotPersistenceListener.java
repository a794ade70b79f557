package oikosnomos.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.entity.BillingSnapshotEntity;
import oikosnomos.billing.event.BillingSnapshotComputedEvent;
import oikosnomos.billing.repository.BillingSnapshotRepository;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Appends each computed snapshot to billing_snapshots through the persistence pool.
 * Runs before any other snapshot listener.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotPersistenceListener {

    private final PersistenceDispatcher persistenceDispatcher;
    private final BillingSnapshotRepository billingSnapshotRepository;

    @EventListener
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public void onSnapshotComputed(BillingSnapshotComputedEvent event) {
        BillingSnapshotEntity row = BillingSnapshotEntity.from(event.getSnapshot());
        boolean queued = persistenceDispatcher.submit("snapshot", row.getHomeId() + "@" + row.getTimestamp(),
                () -> billingSnapshotRepository.save(row));
        if (queued) {
            log.debug("Queued snapshot of home {} at {} for persistence", row.getHomeId(), row.getTimestamp());
        }
    }
}
