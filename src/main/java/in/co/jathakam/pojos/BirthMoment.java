package in.co.jathakam.pojos;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Local civil date and time of birth plus the UTC offset in force at the place of birth.
 * The offset is in hours and may be fractional (e.g. 5.5 for IST).
 */
public final class BirthMoment {

    private final LocalDate date;
    private final LocalTime time;
    private final double utcOffsetHours;

    public BirthMoment(LocalDate date, LocalTime time, double utcOffsetHours) {
        this.date = Objects.requireNonNull(date, "date");
        this.time = Objects.requireNonNull(time, "time");
        this.utcOffsetHours = utcOffsetHours;
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalTime getTime() {
        return time;
    }

    public double getUtcOffsetHours() {
        return utcOffsetHours;
    }

    public LocalDateTime toLocalDateTime() {
        return LocalDateTime.of(date, time);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BirthMoment)) return false;
        BirthMoment that = (BirthMoment) o;
        return Double.compare(utcOffsetHours, that.utcOffsetHours) == 0
                && date.equals(that.date) && time.equals(that.time);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, time, utcOffsetHours);
    }

    @Override
    public String toString() {
        return date + "T" + time + " (UTC" + (utcOffsetHours >= 0 ? "+" : "") + utcOffsetHours + ")";
    }
}
