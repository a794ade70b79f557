package oikosnomos.billing.repository;

import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.model.Reading;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

/**
 * Durable raw_readings hypertable. Appends come from the persistence pool only;
 * the month-to-date aggregate feeds tier selection.
 */
@Repository
@Slf4j
public class RawReadingRepository {

    private static final String INSERT_SQL =
            "INSERT INTO raw_readings (timestamp, home_id, device_category, power_w, energy_wh) " +
            "VALUES (?, ?, ?, ?, ?)";

    // energy_wh when present, otherwise power integrated over the sampling interval
    private static final String SUM_KWH_SQL =
            "SELECT COALESCE(SUM(COALESCE(energy_wh, power_w * ? / 3600.0)), 0) / 1000.0 " +
            "FROM raw_readings " +
            "WHERE home_id = ? AND timestamp >= ? AND timestamp < ?";

    private final JdbcTemplate jdbcTemplate;

    public RawReadingRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Reading reading) {
        jdbcTemplate.update(INSERT_SQL,
                Timestamp.from(reading.getTimestamp()),
                reading.getHomeId(),
                reading.getDeviceCategory(),
                reading.getPowerW(),
                reading.getEnergyWh());
    }

    /**
     * Energy in kWh recorded for a home with from <= timestamp < to.
     */
    public BigDecimal sumEnergyKwh(String homeId, Instant from, Instant to, Duration samplingInterval) {
        double samplingSeconds = samplingInterval.toMillis() / 1000.0;
        BigDecimal kwh = jdbcTemplate.queryForObject(SUM_KWH_SQL, BigDecimal.class,
                samplingSeconds, homeId, Timestamp.from(from), Timestamp.from(to));
        log.debug("Month-to-date for home {} between {} and {}: {} kWh", homeId, from, to, kwh);
        return kwh != null ? kwh : BigDecimal.ZERO;
    }
}
