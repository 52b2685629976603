package devicevault.pipeline.model;

/**
 * How often a backup schedule fires.
 */
public enum Cadence {
    /** Every day at hour:minute */
    DAILY("daily"),
    /** Once a week on day_of_week at hour:minute */
    WEEKLY("weekly"),
    /** Once a month on day_of_month at hour:minute */
    MONTHLY("monthly"),
    /** Five-field cron expression */
    CRON("custom_cron");

    private final String wireValue;

    Cadence(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Cadence fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("cadence is required");
        }
        for (Cadence cadence : values()) {
            if (cadence.wireValue.equalsIgnoreCase(value) || cadence.name().equalsIgnoreCase(value)) {
                return cadence;
            }
        }
        if ("cron".equalsIgnoreCase(value)) {
            return CRON;
        }
        throw new IllegalArgumentException("Unknown cadence: " + value);
    }
}
