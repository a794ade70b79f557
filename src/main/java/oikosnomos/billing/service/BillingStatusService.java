package oikosnomos.billing.service;

import lombok.RequiredArgsConstructor;
import oikosnomos.billing.dto.BillingSnapshotDTO;
import oikosnomos.billing.repository.BillingSnapshotRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the status API.
 */
@Service
@RequiredArgsConstructor
public class BillingStatusService {

    private static final Duration DEFAULT_HISTORY = Duration.ofHours(24);

    private final BillingCalculator billingCalculator;
    private final BillingSnapshotRepository billingSnapshotRepository;
    private final HomeService homeService;
    private final Clock clock;

    public Optional<BillingSnapshotDTO> current(String homeId) {
        return billingCalculator.latest(resolveHomeId(homeId)).map(BillingSnapshotDTO::current);
    }

    /**
     * Persisted snapshots with from <= timestamp <= to, oldest first. Defaults to the last 24 hours.
     */
    @Transactional(readOnly = true)
    public List<BillingSnapshotDTO> history(String homeId, Instant from, Instant to) {
        String id = resolveHomeId(homeId);
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_HISTORY);
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        return billingSnapshotRepository.findByHomeIdAndTimestampBetweenOrderByTimestampAsc(id, start, end)
                .stream()
                .map(BillingSnapshotDTO::history)
                .toList();
    }

    private String resolveHomeId(String homeId) {
        if (homeId != null && !homeId.isBlank()) {
            return homeId;
        }
        List<String> homes = homeService.billedHomeIds();
        if (homes.size() == 1) {
            return homes.get(0);
        }
        throw new IllegalArgumentException("home_id is required when more than one home is billed");
    }
}
