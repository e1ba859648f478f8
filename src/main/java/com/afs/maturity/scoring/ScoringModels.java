package com.afs.maturity.scoring;

import java.time.Instant;
import java.util.List;

public class ScoringModels {
    public record AreaScore(String areaId,
                            String areaName,
                            double percentage,
                            double legacyScore,
                            double coverage,
                            int responsesCount,
                            int totalQuestions,
                            MaturityLevel level,
                            double weight) {

        public static AreaScore empty(String areaId, String areaName) {
            return new AreaScore(areaId, areaName, 0.0, ScoreMath.LEGACY_MIN, 0.0, 0, 0, MaturityLevel.INFORMAL, 1.0);
        }

        public boolean participates() {
            return totalQuestions > 0;
        }
    }

    public record SectionScore(String sectionId,
                               String sectionName,
                               String color,
                               String icon,
                               double percentage,
                               double legacyScore,
                               double coverage,
                               int responsesCount,
                               int totalQuestions,
                               MaturityLevel level,
                               List<AreaScore> areas) {

        public static SectionScore empty(String sectionId, String sectionName, String color, String icon) {
            return new SectionScore(sectionId, sectionName, color, icon, 0.0, ScoreMath.LEGACY_MIN, 0.0, 0, 0,
                    MaturityLevel.INFORMAL, List.of());
        }

        public boolean participates() {
            return totalQuestions > 0;
        }
    }

    public record ImprovementPotential(double currentScore,
                                       MaturityLevel currentLevel,
                                       MaturityLevel targetLevel,
                                       double targetMinScore,
                                       double targetMaxScore,
                                       double gapToTarget,
                                       double potentialImprovement,
                                       boolean achievable) {}

    public record ScoringMetadata(Instant calculatedAt, int totalResponses, String scoringVersion) {}

    public record CompletionStatus(int totalQuestions,
                                   int answeredQuestions,
                                   int unansweredQuestions,
                                   double completionPercentage,
                                   boolean complete,
                                   boolean substantial) {

        public static CompletionStatus of(int answered, int total, double substantialThreshold) {
            return new CompletionStatus(total, answered, total - answered, ScoreMath.percentDown(answered, total),
                    total > 0 && answered >= total, ScoreMath.reaches(answered, total, substantialThreshold));
        }
    }

    public record AssessmentScore(long assessmentId,
                                  String assessmentName,
                                  double overallPercentage,
                                  double overallScore0to5,
                                  MaturityLevel maturityLevel,
                                  String maturityLevelDisplay,
                                  String maturityDescription,
                                  double deviqScore,
                                  ImprovementPotential improvementPotential,
                                  List<SectionScore> sections,
                                  CompletionStatus completion,
                                  ScoringMetadata metadata) {}
}
