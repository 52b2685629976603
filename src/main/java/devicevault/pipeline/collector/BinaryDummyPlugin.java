package devicevault.pipeline.collector;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Demo binary backup: a synthetic firmware blob with a magic header,
 * base64-encoded for transport.
 */
public class BinaryDummyPlugin implements BackupPlugin {

    public static final String KEY = "binary_dummy";

    static final int BLOB_SIZE = 1024 * 1024;
    static final byte[] MAGIC = magic();

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public String description() {
        return "Demo binary backup (1MB dummy firmware)";
    }

    @Override
    public CollectionOutcome collect(Map<String, Object> config, Duration timeout) {
        Object ip = config.get("ip") != null ? config.get("ip") : config.get("ip_address");
        if (ip == null || ip.toString().isBlank()) {
            return CollectionOutcome.failure("missing ip_address in config");
        }

        byte[] blob = new byte[BLOB_SIZE];
        System.arraycopy(MAGIC, 0, blob, 0, MAGIC.length);
        String encoded = Base64.getEncoder().encodeToString(blob);

        return CollectionOutcome.success(encoded, List.of(
                "Connected to device at " + ip,
                "Downloaded binary firmware: " + blob.length + " bytes",
                "Base64 encoded for transport: " + encoded.length() + " bytes"));
    }

    private static byte[] magic() {
        byte[] text = "FIRMWARE_HEADER_DEMO".getBytes(StandardCharsets.US_ASCII);
        byte[] header = new byte[text.length + 2];
        header[0] = (byte) 0xFF;
        header[1] = (byte) 0xFE;
        System.arraycopy(text, 0, header, 2, text.length);
        return header;
    }
}
