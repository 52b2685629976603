package devicevault.pipeline.scheduler;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 *
 * Fields accept a wildcard, single values, ranges ({@code 1-5}), stepped
 * ranges ({@code 0-30/10}, or a stepped wildcard) and comma separated lists. Day-of-week is
 * 0-7 with both 0 and 7 meaning Sunday; months and weekdays also accept
 * three-letter names. When both day fields are restricted a day matches if
 * either matches.
 */
public final class CronExpression {

    private static final Map<String, Integer> MONTH_NAMES = Map.ofEntries(
            Map.entry("JAN", 1), Map.entry("FEB", 2), Map.entry("MAR", 3), Map.entry("APR", 4),
            Map.entry("MAY", 5), Map.entry("JUN", 6), Map.entry("JUL", 7), Map.entry("AUG", 8),
            Map.entry("SEP", 9), Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DEC", 12));

    private static final Map<String, Integer> DAY_NAMES = Map.of(
            "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6);

    /** Give up searching after this many years without a match (e.g. "0 0 30 2 *"). */
    private static final int SEARCH_YEARS = 5;

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthWildcard;
    private final boolean dayOfWeekWildcard;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = parseField(fields[0], 0, 59, Map.of(), "minute");
        this.hours = parseField(fields[1], 0, 23, Map.of(), "hour");
        this.daysOfMonth = parseField(fields[2], 1, 31, Map.of(), "day-of-month");
        this.months = parseField(fields[3], 1, 12, MONTH_NAMES, "month");
        BitSet dow = parseField(fields[4], 0, 7, DAY_NAMES, "day-of-week");
        if (dow.get(7)) {
            dow.set(0);
            dow.clear(7);
        }
        this.daysOfWeek = dow;
        this.dayOfMonthWildcard = fields[2].startsWith("*");
        this.dayOfWeekWildcard = fields[4].startsWith("*");
    }

    /**
     * Parse an expression.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException(
                    "cron expression needs 5 fields, got " + fields.length + ": " + expression);
        }
        return new CronExpression(expression.trim(), fields);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * First matching instant strictly after {@code from}, with the fields read
     * as wall-clock time in {@code zone}. Local times that fall into a DST gap
     * are shifted forward by the length of the gap.
     */
    public Optional<Instant> nextAfter(Instant from, ZoneId zone) {
        LocalDateTime t = LocalDateTime.ofInstant(from, zone).truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDateTime limit = t.plusYears(SEARCH_YEARS);

        while (t.isBefore(limit)) {
            if (!months.get(t.getMonthValue())) {
                t = t.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!dayMatches(t.toLocalDate())) {
                t = t.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!hours.get(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(t.getMinute())) {
                t = t.plusMinutes(1);
                continue;
            }
            Instant candidate = ZonedDateTime.of(t, zone).toInstant();
            if (candidate.isAfter(from)) {
                return Optional.of(candidate);
            }
            t = t.plusMinutes(1);
        }
        return Optional.empty();
    }

    private boolean dayMatches(LocalDate date) {
        boolean domMatch = daysOfMonth.get(date.getDayOfMonth());
        boolean dowMatch = daysOfWeek.get(sundayZero(date.getDayOfWeek()));
        if (dayOfMonthWildcard && dayOfWeekWildcard) {
            return true;
        }
        if (dayOfMonthWildcard) {
            return dowMatch;
        }
        if (dayOfWeekWildcard) {
            return domMatch;
        }
        return domMatch || dowMatch;
    }

    static int sundayZero(DayOfWeek day) {
        return day.getValue() % 7;
    }

    private static BitSet parseField(String field, int min, int max, Map<String, Integer> names, String label) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.split(",")) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("empty " + label + " list element in '" + field + "'");
            }
            String range = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), label);
                if (step < 1) {
                    throw new IllegalArgumentException(label + " step must be positive: " + part);
                }
            }

            int start;
            int end;
            if (range.equals("*")) {
                start = min;
                end = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                start = parseValue(bounds[0], names, label);
                end = parseValue(bounds[1], names, label);
            } else {
                start = parseValue(range, names, label);
                // "5/15" means from 5 to the end of the range
                end = slash >= 0 ? max : start;
            }

            if (start < min || end > max || start > end) {
                throw new IllegalArgumentException(
                        label + " value out of range " + min + "-" + max + ": " + part);
            }
            for (int v = start; v <= end; v += step) {
                bits.set(v);
            }
        }
        return bits;
    }

    private static int parseValue(String token, Map<String, Integer> names, String label) {
        Integer named = names.get(token.toUpperCase(Locale.ROOT));
        return named != null ? named : parseNumber(token, label);
    }

    private static int parseNumber(String token, String label) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + label + " value: '" + token + "'");
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
