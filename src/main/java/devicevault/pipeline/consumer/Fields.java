package devicevault.pipeline.consumer;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Parsing of string-valued stream fields.
 */
final class Fields {

    private Fields() {
    }

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new PoisonMessageException("missing " + field);
        }
        return value.trim();
    }

    static long requireId(String value, String field) {
        String text = requireText(value, field);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new PoisonMessageException("invalid " + field + ": '" + text + "'");
        }
    }

    static Long optionalLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parse an ISO-8601 instant; zone-less values are read as UTC.
     */
    static Instant instantOr(String value, Instant fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String text = value.trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(text + "Z");
            } catch (DateTimeParseException ignored) {
                return fallback;
            }
        }
    }
}
