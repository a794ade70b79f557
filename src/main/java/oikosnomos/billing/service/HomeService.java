package oikosnomos.billing.service;

import lombok.RequiredArgsConstructor;
import oikosnomos.billing.config.BillingProperties;
import oikosnomos.billing.entity.Home;
import oikosnomos.billing.exception.TariffLookupException;
import oikosnomos.billing.repository.HomeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class HomeService {

    private final HomeRepository homeRepository;
    private final BillingProperties properties;

    /**
     * Homes the engine ingests and bills: the configured list, or every home in the store.
     */
    @Transactional(readOnly = true)
    public List<String> billedHomeIds() {
        if (!properties.getHomeIds().isEmpty()) {
            return List.copyOf(properties.getHomeIds());
        }
        return homeRepository.findAllIds();
    }

    @Transactional(readOnly = true)
    public Home requireHome(String homeId) {
        return homeRepository.findById(homeId)
                .orElseThrow(() -> new TariffLookupException("Unknown home " + homeId));
    }
}
