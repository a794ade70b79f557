package oikosnomos.billing.repository;

import oikosnomos.billing.entity.BillingSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Append-only history of billing snapshots.
 */
@Repository
public interface BillingSnapshotRepository extends JpaRepository<BillingSnapshotEntity, BillingSnapshotEntity.Key> {

    /**
     * Snapshots of one home with from <= timestamp <= to, oldest first.
     */
    List<BillingSnapshotEntity> findByHomeIdAndTimestampBetweenOrderByTimestampAsc(
            String homeId, Instant from, Instant to);
}
