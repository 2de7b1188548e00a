package com.id.swl.modules.regularization.logic;

import com.id.swl.exceptions.InvalidRangeException;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

public final class MinuteGrid {

    public static final Duration STEP = Duration.ofMinutes(1);

    private MinuteGrid() {
    }

    /**
     * Floors the instant to the minute containing it.
     */
    public static Instant alignToMinute(Instant t) {
        return t.truncatedTo(ChronoUnit.MINUTES);
    }

    /**
     * Smallest minute mark not before the instant.
     */
    public static Instant ceilToMinute(Instant t) {
        Instant aligned = alignToMinute(t);
        return aligned.isBefore(t) ? aligned.plus(STEP) : aligned;
    }

    public static boolean isAligned(Instant t) {
        return t.getEpochSecond() % 60 == 0 && t.getNano() == 0;
    }

    /**
     * Closed sequence of minute marks from {@code floor(start)} to {@code ceil(end)}.
     * A zero-length interval yields the single mark {@code floor(start)}.
     *
     * @param start - First instant to cover
     * @param end   - Last instant to cover, not before start
     *
     * @return Contiguous minute marks, never empty
     */
    public static List<Instant> minuteGrid(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new InvalidRangeException("Grid bounds cannot be null");
        }
        if (end.isBefore(start)) {
            throw new InvalidRangeException("Grid end %s is before start %s".formatted(end, start));
        }

        Instant first = alignToMinute(start);
        if (start.equals(end)) {
            return List.of(first);
        }
        Instant last = ceilToMinute(end);
        long steps = Duration.between(first, last).toMinutes() + 1;
        if (steps > Integer.MAX_VALUE) {
            throw new InvalidRangeException("Grid [%s, %s] has too many minutes".formatted(start, end));
        }

        List<Instant> grid = new ArrayList<>((int) steps);
        for (long i = 0; i < steps; i++) {
            grid.add(first.plus(i, ChronoUnit.MINUTES));
        }
        return grid;
    }
}
