package devicevault.pipeline.model;

/**
 * Outcome of a collection or storage attempt as it appears on the wire and in
 * the result tables.
 */
public enum ResultStatus {
    SUCCESS("success"),
    FAILURE("failure"),
    /** Scheduled occurrence that was never executed because the scheduler was down */
    MISSED_WINDOW("missed_window");

    private final String wireValue;

    ResultStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Parse a wire value. Anything unrecognised is a failure.
     */
    public static ResultStatus fromWire(String value) {
        if (value != null) {
            for (ResultStatus status : values()) {
                if (status.wireValue.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        return FAILURE;
    }
}
