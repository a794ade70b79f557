package oikosnomos.billing.model;

/**
 * Tariff season. Summer months are listed per tariff, every other month is winter.
 */
public enum Season {
    SUMMER("summer"),
    WINTER("winter");

    private final String key;

    Season(String key) {
        this.key = key;
    }

    /** Key used in the tariff structure JSON. */
    public String key() {
        return key;
    }
}
