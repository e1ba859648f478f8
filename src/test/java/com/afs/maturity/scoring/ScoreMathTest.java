package com.afs.maturity.scoring;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoreMathTest {

    @Test
    void legacyScoreSpansOneToFour() {
        assertEquals(1.0, ScoreMath.legacyScore(0.0));
        assertEquals(2.5, ScoreMath.legacyScore(0.5));
        assertEquals(4.0, ScoreMath.legacyScore(1.0));
        assertEquals(3.25, ScoreMath.legacyScore(0.75));
    }

    @Test
    void averagesAndCoverage() {
        assertEquals(0.0, ScoreMath.simpleAverage(List.of()));
        assertEquals(0.75, ScoreMath.simpleAverage(List.of(0.5, 1.0)));
        assertEquals(0.0, ScoreMath.coverage(0, 0));
        assertEquals(4.0 / 6.0, ScoreMath.coverage(4, 6), 1e-12);
    }

    @Test
    void thresholdCheckIsExact() {
        assertTrue(ScoreMath.reaches(4, 5, 80.0));
        assertFalse(ScoreMath.reaches(7996, 10000, 80.0));
        assertTrue(ScoreMath.reaches(579, 1000, 57.9));
        assertFalse(ScoreMath.reaches(1, 0, 0.0));
        assertEquals(57.9, ScoreMath.percentDown(579, 1000));
    }
}
