package com.afs.maturity.assessment;

import com.afs.maturity.scoring.ScoringModels.AssessmentScore;
import com.afs.maturity.scoring.ScoringModels.CompletionStatus;

import java.time.Instant;
import java.util.List;

public class AssessmentModels {
    public enum AssessmentStatus {
        IN_PROGRESS, COMPLETED, LOCKED;

        public boolean frozen() {
            return this != IN_PROGRESS;
        }
    }

    public record Assessment(long id,
                             String organizationName,
                             String accountName,
                             String firstName,
                             String lastName,
                             String email,
                             String industry,
                             AssessmentStatus status,
                             Instant createdAt,
                             Instant updatedAt,
                             Instant completedAt,
                             Double overallScore,
                             String maturityLevel) {}

    public record Response(long assessmentId, String questionId, Integer score, String notes, Instant answeredAt) {
        public boolean answered() {
            return score != null;
        }

        // 1 = No, 2 = Yes; anything else counts as not confirmed.
        public boolean yes() {
            return score != null && score >= 2;
        }
    }

    public record SectionScoreRow(long assessmentId, String sectionId, double legacyScore, double percentage) {}

    public record CreateAssessmentRequest(String organizationName,
                                          String accountName,
                                          String firstName,
                                          String lastName,
                                          String email,
                                          String industry) {}

    public record AnswerIn(String questionId, Integer score, String notes) {}

    public record SubmitResponsesRequest(List<AnswerIn> answers) {}

    public record SubmitAck(long assessmentId, int accepted, CompletionStatus completion) {}

    public record SectionProgress(String sectionId,
                                  String sectionName,
                                  int totalQuestions,
                                  int answeredQuestions,
                                  double progressPercentage,
                                  boolean complete) {}

    public record NextQuestion(String questionId, String sectionId, String areaId, String text) {}

    public record ProgressReport(long assessmentId,
                                 AssessmentStatus status,
                                 CompletionStatus completion,
                                 boolean canGenerateReport,
                                 List<SectionProgress> sections,
                                 Instant lastResponseAt,
                                 NextQuestion nextQuestion) {}

    public record FinalizeResult(long assessmentId,
                                 AssessmentStatus status,
                                 Instant completedAt,
                                 boolean forced,
                                 AssessmentScore score) {}
}
