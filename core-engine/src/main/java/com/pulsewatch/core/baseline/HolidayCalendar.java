package com.pulsewatch.core.baseline;

import com.pulsewatch.core.config.BaselineSettings;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.MonthDay;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed-date holidays and custom event ranges during which seasonal
 * thresholds are widened.
 *
 * <p>
 * A leniency factor of {@code 1.0} disables widening; this is the default.
 * </p>
 *
 * @since 1.0.0
 */
public final class HolidayCalendar implements Serializable {

    private static final long serialVersionUID = 1L;

    /** A named period treated like a holiday, e.g. a product launch. */
    public record Event(String name, Instant start, Instant end) implements Serializable {
        public Event {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(start, "start must not be null");
            Objects.requireNonNull(end, "end must not be null");
            if (end.isBefore(start)) {
                throw new IllegalArgumentException("Event '" + name + "' ends before it starts");
            }
        }

        boolean contains(Instant at) {
            return !at.isBefore(start) && !at.isAfter(end);
        }
    }

    private final Set<MonthDay> holidays;
    private final List<Event> events;
    private final double holidayLeniency;
    private final double weekendLeniency;

    public HolidayCalendar(Collection<MonthDay> holidays, List<Event> events,
            double holidayLeniency, double weekendLeniency) {
        if (holidayLeniency < 1 || weekendLeniency < 1) {
            throw new IllegalArgumentException("leniency factors must be >= 1");
        }
        this.holidays = Set.copyOf(holidays);
        this.events = List.copyOf(events);
        this.holidayLeniency = holidayLeniency;
        this.weekendLeniency = weekendLeniency;
    }

    public static HolidayCalendar none() {
        return new HolidayCalendar(Set.of(), List.of(), 1.0, 1.0);
    }

    public static HolidayCalendar from(BaselineSettings settings) {
        return new HolidayCalendar(settings.holidayDates(), List.of(),
                settings.getHolidayLeniency(), settings.getWeekendLeniency());
    }

    /**
     * @return a copy of this calendar with one more event
     */
    public HolidayCalendar withEvent(String name, Instant start, Instant end) {
        List<Event> more = new ArrayList<>(events);
        more.add(new Event(name, start, end));
        return new HolidayCalendar(holidays, more, holidayLeniency, weekendLeniency);
    }

    public boolean isHoliday(Instant at, ZoneId zone) {
        if (holidays.contains(MonthDay.from(at.atZone(zone)))) {
            return true;
        }
        for (Event e : events) {
            if (e.contains(at)) {
                return true;
            }
        }
        return false;
    }

    public boolean isWeekend(Instant at, ZoneId zone) {
        DayOfWeek day = at.atZone(zone).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /**
     * @return the factor by which deviation thresholds are multiplied at {@code at}
     */
    public double leniency(Instant at, ZoneId zone) {
        double factor = 1.0;
        if (isHoliday(at, zone)) {
            factor = Math.max(factor, holidayLeniency);
        }
        if (isWeekend(at, zone)) {
            factor = Math.max(factor, weekendLeniency);
        }
        return factor;
    }

    /**
     * @return e.g. {@code "holiday"}, {@code "weekend"} or {@code null} on a regular day
     */
    public String dayKind(Instant at, ZoneId zone) {
        if (isHoliday(at, zone)) {
            return "holiday";
        }
        return isWeekend(at, zone) ? "weekend" : null;
    }
}
