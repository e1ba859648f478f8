package com.afs.maturity.scoring;

import com.afs.maturity.scoring.ScoringModels.CompletionStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CompletionStatusTest {

    @Test
    void eightyPercentIsSubstantial() {
        CompletionStatus status = CompletionStatus.of(4, 5, 80.0);
        assertEquals(80.0, status.completionPercentage());
        assertTrue(status.substantial());
        assertFalse(status.complete());
        assertEquals(1, status.unansweredQuestions());
    }

    @Test
    void justBelowThresholdIsNotSubstantial() {
        CompletionStatus status = CompletionStatus.of(799, 1000, 80.0);
        assertEquals(79.9, status.completionPercentage());
        assertFalse(status.substantial());
    }

    @Test
    void reportedPercentageNeverReadsAsThresholdWhileGateRefuses() {
        CompletionStatus status = CompletionStatus.of(7996, 10000, 80.0);
        assertEquals(79.9, status.completionPercentage());
        assertFalse(status.substantial());

        CompletionStatus exactly = CompletionStatus.of(8000, 10000, 80.0);
        assertEquals(80.0, exactly.completionPercentage());
        assertTrue(exactly.substantial());
    }

    @Test
    void percentageIsTruncatedNotRounded() {
        assertEquals(66.6, CompletionStatus.of(2, 3, 80.0).completionPercentage());
        assertEquals(99.9, CompletionStatus.of(9999, 10000, 80.0).completionPercentage());
        assertFalse(CompletionStatus.of(9999, 10000, 80.0).complete());
    }

    @Test
    void everythingAnsweredIsComplete() {
        CompletionStatus status = CompletionStatus.of(3, 3, 80.0);
        assertTrue(status.complete());
        assertTrue(status.substantial());
        assertEquals(100.0, status.completionPercentage());
    }

    @Test
    void emptyScopeIsNeitherCompleteNorSubstantial() {
        CompletionStatus status = CompletionStatus.of(0, 0, 80.0);
        assertEquals(0.0, status.completionPercentage());
        assertFalse(status.complete());
        assertFalse(status.substantial());
    }
}
