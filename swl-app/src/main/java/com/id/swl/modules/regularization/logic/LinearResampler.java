package com.id.swl.modules.regularization.logic;

import com.id.swl.modules.regularization.model.TimedValue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class LinearResampler {

    private LinearResampler() {
    }

    /**
     * Resamples the samples onto {@link MinuteGrid#minuteGrid(Instant, Instant)}.
     * <p>
     * Non-finite values are dropped first. Grid marks inside the sample span are linearly
     * interpolated between the two bracketing samples; marks outside take the value of the
     * nearest boundary sample. When several samples share a timestamp the last one wins.
     *
     * @param samples - Samples in any order
     * @param start   - Start of the interval to cover
     * @param end     - End of the interval to cover
     *
     * @return One finite value per grid mark, or an empty list when fewer than two finite
     * samples are available
     */
    public static List<TimedValue> resampleToMinute(Collection<TimedValue> samples, Instant start, Instant end) {
        List<TimedValue> finite = TimedValue.sortedByTime(samples).stream()
                .filter(TimedValue::isFinite)
                .toList();
        if (finite.size() < 2) {
            return List.of();
        }

        List<TimedValue> points = lastWinsPerTimestamp(finite);
        List<Instant> grid = MinuteGrid.minuteGrid(start, end);

        TimedValue first = points.get(0);
        TimedValue last = points.get(points.size() - 1);

        List<TimedValue> out = new ArrayList<>(grid.size());
        int k = 0;
        for (Instant g : grid) {
            double v;
            if (!g.isAfter(first.time())) {
                v = first.value();
            } else if (!g.isBefore(last.time())) {
                v = last.value();
            } else {
                // points[k].time < g <= points[k + 1].time
                while (points.get(k + 1).time().isBefore(g)) {
                    k++;
                }
                TimedValue left = points.get(k);
                TimedValue right = points.get(k + 1);
                v = right.time().equals(g) ? right.value() : interpolate(left, right, g);
            }
            out.add(new TimedValue(g, v));
        }
        return out;
    }

    private static double interpolate(TimedValue left, TimedValue right, Instant at) {
        double span = Duration.between(left.time(), right.time()).toNanos();
        double elapsed = Duration.between(left.time(), at).toNanos();
        double slope = (right.value() - left.value()) / span;
        return left.value() + slope * elapsed;
    }

    private static List<TimedValue> lastWinsPerTimestamp(List<TimedValue> sorted) {
        List<TimedValue> distinct = new ArrayList<>(sorted.size());
        for (TimedValue sample : sorted) {
            int lastIdx = distinct.size() - 1;
            if (lastIdx >= 0 && distinct.get(lastIdx).time().equals(sample.time())) {
                distinct.set(lastIdx, sample);
            } else {
                distinct.add(sample);
            }
        }
        return distinct;
    }
}
