package devicevault.pipeline.scheduler;

import devicevault.pipeline.model.Schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pure cadence math. Schedules are wall-clock definitions in the display
 * timezone; results are UTC instants. Nothing here reads the system clock.
 */
public final class CadenceCalculator {

    /** Longest gap between two occurrences of a non-cron cadence, with slack. */
    private static final int MAX_DAYS_SCANNED = 400;

    private CadenceCalculator() {
    }

    /**
     * Next occurrence strictly after {@code from}.
     *
     * @return empty if the schedule never fires again
     */
    public static Optional<Instant> nextDue(Schedule schedule, Instant from, ZoneId zone) {
        switch (schedule.cadence()) {
            case CRON:
                return CronExpression.parse(schedule.cronExpression()).nextAfter(from, zone);
            case DAILY:
            case WEEKLY:
            case MONTHLY:
                return nextCalendarOccurrence(schedule, from, zone);
            default:
                throw new IllegalStateException("Unhandled cadence: " + schedule.cadence());
        }
    }

    /**
     * All occurrences in {@code (fromExclusive, toInclusive]}, in chronological
     * order, at most {@code limit} of them.
     */
    public static List<Instant> dueBetween(Schedule schedule, Instant fromExclusive, Instant toInclusive,
            ZoneId zone, int limit) {
        List<Instant> due = new ArrayList<>();
        Instant cursor = fromExclusive;
        while (due.size() < limit) {
            Optional<Instant> next = nextDue(schedule, cursor, zone);
            if (next.isEmpty() || next.get().isAfter(toInclusive)) {
                break;
            }
            due.add(next.get());
            cursor = next.get();
        }
        return due;
    }

    private static Optional<Instant> nextCalendarOccurrence(Schedule schedule, Instant from, ZoneId zone) {
        LocalTime at = LocalTime.of(schedule.hour(), schedule.minute());
        // start one day early so a wall time that maps before midnight UTC is not skipped
        LocalDate date = ZonedDateTime.ofInstant(from, zone).toLocalDate().minusDays(1);

        for (int i = 0; i < MAX_DAYS_SCANNED; i++, date = date.plusDays(1)) {
            if (!matchesDay(schedule, date)) {
                continue;
            }
            Instant candidate = ZonedDateTime.of(date, at, zone).toInstant();
            if (candidate.isAfter(from)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean matchesDay(Schedule schedule, LocalDate date) {
        switch (schedule.cadence()) {
            case WEEKLY:
                return CronExpression.sundayZero(date.getDayOfWeek()) == schedule.dayOfWeek();
            case MONTHLY:
                // months without this day are skipped, not clamped
                return date.getDayOfMonth() == schedule.dayOfMonth();
            default:
                return true;
        }
    }
}
