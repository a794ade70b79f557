package oikosnomos.billing.controller;

import oikosnomos.billing.dto.BillingSnapshotDTO;
import oikosnomos.billing.exception.DependencyException;
import oikosnomos.billing.exception.GlobalExceptionHandler;
import oikosnomos.billing.service.BillingStatusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class BillingStatusControllerTest {

    private BillingStatusService statusService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        statusService = mock(BillingStatusService.class);
        mvc = MockMvcBuilders.standaloneSetup(new BillingStatusController(statusService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void health_isHealthy() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", equalTo("healthy")));
    }

    @Test
    void current_returnsLatestSnapshot() throws Exception {
        when(statusService.current("home-1")).thenReturn(Optional.of(snapshot("2025-07-15T17:30:00Z")));

        mvc.perform(get("/billing/current").param("home_id", "home-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.home_id", equalTo("home-1")))
                .andExpect(jsonPath("$.cost_today", equalTo(2.25)))
                .andExpect(jsonPath("$.tariff", equalTo("pge_e6_2025")));
    }

    @Test
    void current_beforeFirstSnapshot_is404() throws Exception {
        when(statusService.current("home-1")).thenReturn(Optional.empty());

        mvc.perform(get("/billing/current").param("home_id", "home-1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void current_ambiguousHome_is400() throws Exception {
        when(statusService.current(isNull()))
                .thenThrow(new IllegalArgumentException("home_id is required when more than one home is billed"));

        mvc.perform(get("/billing/current"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("home_id")));
    }

    @Test
    void history_passesRangeThrough() throws Exception {
        Instant from = Instant.parse("2025-07-15T00:00:00Z");
        Instant to = Instant.parse("2025-07-15T12:00:00Z");
        when(statusService.history("home-1", from, to)).thenReturn(List.of(
                snapshot("2025-07-15T06:00:00Z"), snapshot("2025-07-15T11:55:00Z")));

        mvc.perform(get("/billing/history")
                        .param("home_id", "home-1")
                        .param("from", "2025-07-15T00:00:00Z")
                        .param("to", "2025-07-15T12:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].timestamp", equalTo("2025-07-15T06:00:00Z")));
    }

    @Test
    void history_malformedInstant_is400() throws Exception {
        mvc.perform(get("/billing/history").param("home_id", "home-1").param("from", "last tuesday"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(statusService);
    }

    @Test
    void history_storeDown_is503() throws Exception {
        when(statusService.history(eq("home-1"), any(), any()))
                .thenThrow(new DependencyException("store unavailable", null));

        mvc.perform(get("/billing/history").param("home_id", "home-1"))
                .andExpect(status().isServiceUnavailable());
    }

    private static BillingSnapshotDTO snapshot(String timestamp) {
        return BillingSnapshotDTO.builder()
                .timestamp(timestamp)
                .homeId("home-1")
                .costToday(new BigDecimal("2.25"))
                .energyTodayKwh(new BigDecimal("5.0"))
                .projectedMonth(new BigDecimal("4.65"))
                .co2TodayKg(new BigDecimal("2.1"))
                .currentRate(new BigDecimal("0.45"))
                .tariffId(1L)
                .tariff("pge_e6_2025")
                .fixedChargeMonthly(BigDecimal.TEN)
                .build();
    }
}
