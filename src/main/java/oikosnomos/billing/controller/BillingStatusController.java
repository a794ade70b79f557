package oikosnomos.billing.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.dto.BillingSnapshotDTO;
import oikosnomos.billing.service.BillingStatusService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Billing", description = "Liveness and billing snapshots")
public class BillingStatusController {

    private final BillingStatusService billingStatusService;

    @GetMapping("/health")
    @Operation(summary = "Liveness probe")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }

    @GetMapping("/billing/current")
    @Operation(summary = "Latest snapshot of a home",
               description = "404 until the first snapshot of the home has been computed")
    public ResponseEntity<BillingSnapshotDTO> current(
            @Parameter(description = "Optional when exactly one home is billed")
            @RequestParam(name = "home_id", required = false) String homeId) {
        return billingStatusService.current(homeId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/billing/history")
    @Operation(summary = "Persisted snapshots of a home",
               description = "from and to are RFC3339 instants; defaults to the last 24 hours")
    public ResponseEntity<List<BillingSnapshotDTO>> history(
            @RequestParam(name = "home_id", required = false) String homeId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        List<BillingSnapshotDTO> snapshots = billingStatusService.history(homeId, from, to);
        log.debug("Returning {} snapshot(s) of home {}", snapshots.size(), homeId);
        return ResponseEntity.ok(snapshots);
    }
}
