package com.id.swl.modules.regularization.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

public record TimedValue(
        Instant time,
        double value
) {

    public static final Comparator<TimedValue> BY_TIME = Comparator.comparing(TimedValue::time);

    public boolean isFinite() {
        return Double.isFinite(value);
    }

    /**
     * Stable sort by timestamp: samples sharing a timestamp keep their input order.
     */
    public static List<TimedValue> sortedByTime(Collection<TimedValue> samples) {
        if (samples == null || samples.isEmpty()) {
            return List.of();
        }
        return samples.stream().sorted(BY_TIME).toList();
    }
}
