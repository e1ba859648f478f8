package com.afs.maturity.error;

import com.afs.maturity.assessment.AssessmentModels.AssessmentStatus;

/**
 * Operation not permitted in the assessment's current lifecycle status, such as a
 * response written to a COMPLETED or LOCKED assessment.
 */
public class AssessmentStateException extends RuntimeException {
    private final long assessmentId;
    private final AssessmentStatus status;

    public AssessmentStateException(long assessmentId, AssessmentStatus status, String message) {
        super(message);
        this.assessmentId = assessmentId;
        this.status = status;
    }

    public long getAssessmentId() {
        return assessmentId;
    }

    public AssessmentStatus getStatus() {
        return status;
    }
}
