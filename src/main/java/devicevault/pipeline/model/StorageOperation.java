package devicevault.pipeline.model;

/**
 * Operation carried by a storage job and echoed on the storage-results stream.
 */
public enum StorageOperation {
    STORE("store"),
    READ("read");

    private final String wireValue;

    StorageOperation(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /** Missing operation means store, matching what older workers published. */
    public static StorageOperation fromWire(String value) {
        if (value == null || value.isBlank()) {
            return STORE;
        }
        for (StorageOperation op : values()) {
            if (op.wireValue.equalsIgnoreCase(value.trim())) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown storage operation: " + value);
    }
}
