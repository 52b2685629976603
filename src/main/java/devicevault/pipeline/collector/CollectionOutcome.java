package devicevault.pipeline.collector;

import java.util.List;

/**
 * What a plugin produced for one device.
 *
 * @param success      whether collection worked
 * @param deviceConfig collected artifact (base64 for binary plugins), null on failure
 * @param log          plugin log lines
 */
public record CollectionOutcome(boolean success, String deviceConfig, List<String> log) {

    public CollectionOutcome {
        log = log == null ? List.of() : List.copyOf(log);
    }

    public static CollectionOutcome success(String deviceConfig, List<String> log) {
        return new CollectionOutcome(true, deviceConfig, log);
    }

    public static CollectionOutcome failure(String... log) {
        return new CollectionOutcome(false, null, List.of(log));
    }
}
