package oikosnomos.billing.tariff;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.entity.Home;
import oikosnomos.billing.entity.Tariff;
import oikosnomos.billing.exception.TariffLookupException;
import oikosnomos.billing.model.TariffDefinition;
import oikosnomos.billing.repository.TariffRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads tariffs and caches the parsed definitions by id. Tariff rows are
 * immutable once effective, so entries never need invalidation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TariffCatalog {

    private final TariffRepository tariffRepository;
    private final TariffParser tariffParser;

    private final Map<Long, TariffDefinition> cache = new ConcurrentHashMap<>();

    /**
     * The home's tariff, provided it is in effect on the home's local date of {@code at}.
     */
    public TariffDefinition activeTariff(Home home, Instant at) {
        Long tariffId = home.getActiveTariffId();
        if (tariffId == null) {
            throw new TariffLookupException("Home " + home.getId() + " has no active tariff");
        }
        TariffDefinition tariff = byId(tariffId);
        LocalDate localDate = at.atZone(home.zone()).toLocalDate();
        if (!tariff.isActiveOn(localDate)) {
            throw new TariffLookupException("Tariff " + tariff.getName() + " of home " + home.getId()
                    + " is not in effect on " + localDate);
        }
        return tariff;
    }

    public TariffDefinition byId(Long tariffId) {
        TariffDefinition cached = cache.get(tariffId);
        if (cached != null) {
            return cached;
        }
        Tariff row = tariffRepository.findById(tariffId)
                .orElseThrow(() -> new TariffLookupException("Tariff " + tariffId + " not found"));
        TariffDefinition parsed = tariffParser.parse(row);
        log.info("Loaded tariff {} ({}) with {} tier(s)", parsed.getName(), parsed.getUtility(), parsed.getTiers().size());
        TariffDefinition existing = cache.putIfAbsent(tariffId, parsed);
        return existing != null ? existing : parsed;
    }
}
