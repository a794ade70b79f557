package oikosnomos.billing.tariff;

import com.fasterxml.jackson.databind.ObjectMapper;
import oikosnomos.billing.entity.Home;
import oikosnomos.billing.entity.Tariff;
import oikosnomos.billing.exception.TariffLookupException;
import oikosnomos.billing.model.TariffDefinition;
import oikosnomos.billing.repository.TariffRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TariffCatalogTest {

    private TariffRepository tariffs;
    private TariffCatalog catalog;

    @BeforeEach
    void setUp() {
        tariffs = mock(TariffRepository.class);
        catalog = new TariffCatalog(tariffs, new TariffParser(new ObjectMapper()));
        when(tariffs.findById(TestTariffs.PGE_E6_ID)).thenReturn(Optional.of(TestTariffs.pgeE6Row()));
    }

    @Test
    void activeTariff_resolvesAndCaches() {
        Home home = home("UTC", TestTariffs.PGE_E6_ID);

        TariffDefinition first = catalog.activeTariff(home, Instant.parse("2025-07-15T12:00:00Z"));
        TariffDefinition second = catalog.activeTariff(home, Instant.parse("2025-07-16T12:00:00Z"));

        assertSame(first, second);
        verify(tariffs, times(1)).findById(TestTariffs.PGE_E6_ID);
    }

    @Test
    void activeTariff_homeWithoutTariff_isLookupError() {
        assertThrows(TariffLookupException.class,
                () -> catalog.activeTariff(home("UTC", null), Instant.parse("2025-07-15T12:00:00Z")));
    }

    @Test
    void activeTariff_beforeEffectiveDateInHomeZone_isLookupError() {
        // 2025-01-01T03:00Z is still New Year's Eve in Los Angeles
        Home home = home("America/Los_Angeles", TestTariffs.PGE_E6_ID);

        assertThrows(TariffLookupException.class,
                () -> catalog.activeTariff(home, Instant.parse("2025-01-01T03:00:00Z")));
    }

    @Test
    void activeTariff_afterEndDate_isLookupError() {
        Tariff row = TestTariffs.pgeE6Row();
        row.setEndDate(LocalDate.of(2025, 7, 1));
        when(tariffs.findById(TestTariffs.PGE_E6_ID)).thenReturn(Optional.of(row));

        assertThrows(TariffLookupException.class,
                () -> catalog.activeTariff(home("UTC", TestTariffs.PGE_E6_ID), Instant.parse("2025-07-15T12:00:00Z")));
    }

    @Test
    void byId_unknown_isLookupError() {
        when(tariffs.findById(99L)).thenReturn(Optional.empty());

        assertThrows(TariffLookupException.class, () -> catalog.byId(99L));
    }

    private static Home home(String zone, Long tariffId) {
        return Home.builder().id("home-1").name("Test home").timezone(zone).activeTariffId(tariffId).build();
    }
}
