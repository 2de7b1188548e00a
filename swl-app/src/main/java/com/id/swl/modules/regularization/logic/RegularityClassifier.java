package com.id.swl.modules.regularization.logic;

import com.id.swl.modules.regularization.model.TimedValue;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

public final class RegularityClassifier {

    private RegularityClassifier() {
    }

    /**
     * Tells whether the samples already sit on a one-minute grid: every timestamp has zero
     * seconds and sub-seconds, and every gap between neighbours is a whole number of minutes.
     * Values are not inspected. An empty collection is not regular.
     */
    public static boolean isRegularMinuteSeries(Collection<TimedValue> samples) {
        List<TimedValue> sorted = TimedValue.sortedByTime(samples);
        if (sorted.isEmpty()) {
            return false;
        }

        Instant previous = null;
        for (TimedValue sample : sorted) {
            Instant t = sample.time();
            if (!MinuteGrid.isAligned(t)) {
                return false;
            }
            if (previous != null) {
                Duration gap = Duration.between(previous, t);
                if (gap.getNano() != 0 || gap.getSeconds() % 60 != 0) {
                    return false;
                }
            }
            previous = t;
        }
        return true;
    }
}
