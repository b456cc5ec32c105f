package com.contractorscheduling.scheduling.domain.availability;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)} on the absolute timeline.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    public static TimeWindow of(Instant start, Duration length) {
        return new TimeWindow(start, start.plus(length));
    }

    public boolean overlaps(TimeWindow other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(TimeWindow other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public TimeWindow expand(Duration padding) {
        return new TimeWindow(start.minus(padding), end.plus(padding));
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    public boolean isEmpty() {
        return !start.isBefore(end);
    }

    /**
     * Removes {@code cut} from this window, leaving zero, one or two pieces.
     */
    public List<TimeWindow> minus(TimeWindow cut) {
        List<TimeWindow> pieces = new ArrayList<>(2);
        if (!overlaps(cut)) {
            pieces.add(this);
            return pieces;
        }
        if (start.isBefore(cut.start)) {
            pieces.add(new TimeWindow(start, cut.start));
        }
        if (cut.end.isBefore(end)) {
            pieces.add(new TimeWindow(cut.end, end));
        }
        return pieces;
    }
}
