package devicevault.pipeline.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Backup schedule definition.
 * hour/minute/dayOfWeek/dayOfMonth are wall-clock values in the display
 * timezone; lastRunAt and nextRunAt are UTC instants. nextRunAt is a display
 * cache and is never used to decide whether the schedule is due.
 */
public final class Schedule {
    private final long id;
    private final String name;
    private final Cadence cadence;
    private final int hour;
    private final int minute;
    private final Integer dayOfWeek; // 0=Sunday .. 6=Saturday
    private final Integer dayOfMonth; // 1..31
    private final String cronExpression;
    private final boolean enabled;
    private final Instant lastRunAt;
    private final Instant nextRunAt;

    private Schedule(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.cadence = Objects.requireNonNull(builder.cadence, "cadence is required");
        this.hour = builder.hour;
        this.minute = builder.minute;
        this.dayOfWeek = builder.dayOfWeek;
        this.dayOfMonth = builder.dayOfMonth;
        this.cronExpression = builder.cronExpression;
        this.enabled = builder.enabled;
        this.lastRunAt = builder.lastRunAt;
        this.nextRunAt = builder.nextRunAt;

        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be 0-23: " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute must be 0-59: " + minute);
        }
        if (cadence == Cadence.WEEKLY && (dayOfWeek == null || dayOfWeek < 0 || dayOfWeek > 6)) {
            throw new IllegalArgumentException("weekly schedule needs day_of_week 0-6: " + dayOfWeek);
        }
        if (cadence == Cadence.MONTHLY && (dayOfMonth == null || dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new IllegalArgumentException("monthly schedule needs day_of_month 1-31: " + dayOfMonth);
        }
        if (cadence == Cadence.CRON && (cronExpression == null || cronExpression.isBlank())) {
            throw new IllegalArgumentException("cron schedule needs a cron expression");
        }
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Cadence cadence() {
        return cadence;
    }

    public int hour() {
        return hour;
    }

    public int minute() {
        return minute;
    }

    public Integer dayOfWeek() {
        return dayOfWeek;
    }

    public Integer dayOfMonth() {
        return dayOfMonth;
    }

    public String cronExpression() {
        return cronExpression;
    }

    public boolean enabled() {
        return enabled;
    }

    public Instant lastRunAt() {
        return lastRunAt;
    }

    public Instant nextRunAt() {
        return nextRunAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .cadence(cadence)
                .hour(hour)
                .minute(minute)
                .dayOfWeek(dayOfWeek)
                .dayOfMonth(dayOfMonth)
                .cronExpression(cronExpression)
                .enabled(enabled)
                .lastRunAt(lastRunAt)
                .nextRunAt(nextRunAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String name;
        private Cadence cadence = Cadence.DAILY;
        private int hour;
        private int minute;
        private Integer dayOfWeek;
        private Integer dayOfMonth;
        private String cronExpression;
        private boolean enabled = true;
        private Instant lastRunAt;
        private Instant nextRunAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder cadence(Cadence cadence) {
            this.cadence = cadence;
            return this;
        }

        public Builder hour(int hour) {
            this.hour = hour;
            return this;
        }

        public Builder minute(int minute) {
            this.minute = minute;
            return this;
        }

        public Builder dayOfWeek(Integer dayOfWeek) {
            this.dayOfWeek = dayOfWeek;
            return this;
        }

        public Builder dayOfMonth(Integer dayOfMonth) {
            this.dayOfMonth = dayOfMonth;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Schedule build() {
            return new Schedule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Schedule schedule))
            return false;
        return id == schedule.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Schedule{id=" + id + ", name='" + name + "', cadence=" + cadence + "}";
    }
}
