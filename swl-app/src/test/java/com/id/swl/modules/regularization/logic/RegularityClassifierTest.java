package com.id.swl.modules.regularization.logic;

import com.id.swl.modules.regularization.model.TimedValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegularityClassifierTest {

    private static TimedValue at(String iso, double value) {
        return new TimedValue(Instant.parse(iso), value);
    }

    @Test
    void emptyIsNotRegular() {
        assertFalse(RegularityClassifier.isRegularMinuteSeries(List.of()));
        assertFalse(RegularityClassifier.isRegularMinuteSeries(null));
    }

    @Test
    void singlePointOnMinuteIsRegular() {
        assertTrue(RegularityClassifier.isRegularMinuteSeries(List.of(at("2004-11-07T12:00:00.000Z", 1.0))));
    }

    @Test
    void singlePointWithHalfSecondIsNotRegular() {
        assertFalse(RegularityClassifier.isRegularMinuteSeries(List.of(at("2004-11-07T12:00:00.500Z", 1.0))));
    }

    @Test
    void adjacentMinutesAreRegular() {
        assertTrue(RegularityClassifier.isRegularMinuteSeries(List.of(
                at("2004-11-07T12:00:00Z", 1.0),
                at("2004-11-07T12:01:00Z", 2.0))));
    }

    @Test
    void halfMinuteGapIsNotRegular() {
        assertFalse(RegularityClassifier.isRegularMinuteSeries(List.of(
                at("2004-11-07T12:00:00Z", 1.0),
                at("2004-11-07T12:00:30Z", 2.0))));
    }

    @Test
    void gapsOfSeveralMinutesInAnyOrderAreRegular() {
        assertTrue(RegularityClassifier.isRegularMinuteSeries(List.of(
                at("2004-11-07T12:07:00Z", 3.0),
                at("2004-11-07T12:00:00Z", 1.0),
                at("2004-11-07T12:02:00Z", 2.0))));
    }

    @Test
    void valuesAreNotInspected() {
        assertTrue(RegularityClassifier.isRegularMinuteSeries(List.of(
                at("2004-11-07T12:00:00Z", Double.NaN),
                at("2004-11-07T12:01:00Z", Double.POSITIVE_INFINITY))));
    }

    @Test
    void oneMisalignedPointAmongManyBreaksRegularity() {
        assertFalse(RegularityClassifier.isRegularMinuteSeries(List.of(
                at("2004-11-07T12:00:00Z", 1.0),
                at("2004-11-07T12:01:00Z", 2.0),
                at("2004-11-07T12:02:00.000001Z", 3.0))));
    }
}
