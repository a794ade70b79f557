package oikosnomos.billing.model;

/**
 * Time-of-use period of an hour of the day.
 */
public enum TouPeriod {
    OFF_PEAK("off_peak"),
    PARTIAL_PEAK("partial_peak"),
    PEAK("peak");

    private final String key;

    TouPeriod(String key) {
        this.key = key;
    }

    /** Key used in the tariff structure JSON rate tables. */
    public String key() {
        return key;
    }
}
