package com.thorbis.security.policy;

import com.thorbis.security.ConstraintCategory;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Request must fall inside a daily window on the listed days, in the tenant's zone.
 * <p>
 * {@code start} is inclusive and {@code end} exclusive. When {@code end} is before {@code start}
 * the window runs overnight and the day check applies to the day the window opened.
 *
 * @param days  days the window opens on; empty means every day
 * @param start opening time
 * @param end   closing time
 * @param zone  IANA zone id, e.g. "America/Chicago"
 */
public record TimeWindow(List<DayOfWeek> days, LocalTime start, LocalTime end, String zone)
        implements GrantConstraint {

    public TimeWindow {
        days = days == null ? List.of() : List.copyOf(days);
    }

    @Override
    public ConstraintCategory category() {
        return ConstraintCategory.OUTSIDE_TIME_WINDOW;
    }

    @Override
    public boolean test(ConstraintInput input) {
        ZonedDateTime local = input.now().atZone(ZoneId.of(zone));
        LocalTime time = local.toLocalTime();
        DayOfWeek day = local.getDayOfWeek();
        if (start.isBefore(end)) {
            return opensOn(day) && !time.isBefore(start) && time.isBefore(end);
        }
        if (!time.isBefore(start)) {
            return opensOn(day);
        }
        return time.isBefore(end) && opensOn(day.minus(1));
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (start == null || end == null) {
            errors.add("time_window requires start and end");
        } else if (start.equals(end)) {
            errors.add("time_window start and end must differ");
        }
        if (zone == null) {
            errors.add("time_window requires a zone");
        } else {
            try {
                ZoneId.of(zone);
            } catch (DateTimeException e) {
                errors.add("time_window zone is not a valid zone id: " + zone);
            }
        }
        return errors;
    }

    private boolean opensOn(DayOfWeek day) {
        return days.isEmpty() || days.contains(day);
    }
}
