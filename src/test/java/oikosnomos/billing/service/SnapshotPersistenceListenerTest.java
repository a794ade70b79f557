package oikosnomos.billing.service;

import oikosnomos.billing.entity.BillingSnapshotEntity;
import oikosnomos.billing.event.BillingSnapshotComputedEvent;
import oikosnomos.billing.model.BillingSnapshot;
import oikosnomos.billing.repository.BillingSnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SnapshotPersistenceListenerTest {

    private PersistenceDispatcher dispatcher;
    private BillingSnapshotRepository repository;
    private SnapshotPersistenceListener listener;

    @BeforeEach
    void setUp() {
        dispatcher = mock(PersistenceDispatcher.class);
        repository = mock(BillingSnapshotRepository.class);
        listener = new SnapshotPersistenceListener(dispatcher, repository);
    }

    @Test
    void onSnapshotComputed_savesEveryColumnThroughDispatcher() {
        when(dispatcher.submit(anyString(), anyString(), any(Runnable.class))).thenReturn(true);
        BillingSnapshot snapshot = BillingSnapshot.builder()
                .timestamp(Instant.parse("2025-07-15T17:30:00Z"))
                .homeId("home-1")
                .localDate(LocalDate.of(2025, 7, 15))
                .costToday(new BigDecimal("2.2500"))
                .energyTodayKwh(new BigDecimal("5.0000"))
                .projectedMonth(new BigDecimal("4.6500"))
                .co2TodayKg(new BigDecimal("2.1000"))
                .currentRate(new BigDecimal("0.45"))
                .tariffId(7L)
                .tariffName("pge_e6_2025")
                .fixedChargeMonthly(BigDecimal.TEN)
                .build();

        listener.onSnapshotComputed(new BillingSnapshotComputedEvent("home-1", snapshot));

        ArgumentCaptor<Runnable> write = ArgumentCaptor.forClass(Runnable.class);
        verify(dispatcher).submit(eq("snapshot"), eq("home-1@2025-07-15T17:30:00Z"), write.capture());
        verifyNoInteractions(repository);

        write.getValue().run();

        ArgumentCaptor<BillingSnapshotEntity> saved = ArgumentCaptor.forClass(BillingSnapshotEntity.class);
        verify(repository).save(saved.capture());
        BillingSnapshotEntity row = saved.getValue();
        assertEquals("home-1", row.getHomeId());
        assertEquals(Instant.parse("2025-07-15T17:30:00Z"), row.getTimestamp());
        assertEquals(new BigDecimal("2.2500"), row.getCostToday());
        assertEquals(new BigDecimal("5.0000"), row.getEnergyTodayKwh());
        assertEquals(new BigDecimal("4.6500"), row.getProjectedMonth());
        assertEquals(new BigDecimal("2.1000"), row.getCo2TodayKg());
        assertEquals(new BigDecimal("0.45"), row.getCurrentRate());
        assertEquals(7L, row.getTariffId());
    }

    @Test
    void onSnapshotComputed_queueFull_doesNotSave() {
        when(dispatcher.submit(anyString(), anyString(), any(Runnable.class))).thenReturn(false);
        BillingSnapshot snapshot = BillingSnapshot.builder()
                .timestamp(Instant.parse("2025-07-15T17:30:00Z"))
                .homeId("home-1")
                .costToday(BigDecimal.ZERO)
                .energyTodayKwh(BigDecimal.ZERO)
                .build();

        assertDoesNotThrow(() -> listener.onSnapshotComputed(new BillingSnapshotComputedEvent("home-1", snapshot)));

        verifyNoInteractions(repository);
    }
}
