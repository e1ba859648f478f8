package com.afs.maturity.error;

import com.afs.maturity.scoring.ScoringModels.CompletionStatus;

import java.util.Locale;

public class IncompleteAssessmentException extends RuntimeException {
    private final CompletionStatus completion;

    public IncompleteAssessmentException(long assessmentId, CompletionStatus completion, double threshold) {
        super(String.format(Locale.US,
                "Assessment %d is %.1f%% complete; at least %.1f%% is required before finalization",
                assessmentId, completion.completionPercentage(), threshold));
        this.completion = completion;
    }

    public CompletionStatus getCompletion() {
        return completion;
    }
}
