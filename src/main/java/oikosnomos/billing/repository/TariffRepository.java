package oikosnomos.billing.repository;

import oikosnomos.billing.entity.Tariff;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Read-only access to tariff rows.
 */
@Repository
public interface TariffRepository extends JpaRepository<Tariff, Long> {
}
