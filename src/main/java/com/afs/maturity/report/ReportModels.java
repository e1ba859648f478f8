package com.afs.maturity.report;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ReportModels {
    /** Current state of one area: its band plus the questions confirmed (strengths) and not yet confirmed (gaps). */
    public record ReportArea(String areaId,
                             String name,
                             double percentage,
                             String level,
                             int levelRank,
                             String levelDescription,
                             List<String> strengths,
                             List<String> gaps) {}

    public record ReportSection(String sectionId,
                                String name,
                                String color,
                                double percentage,
                                double score,
                                String level,
                                List<ReportArea> areas) {}

    public record Insight(String type, String title, String description, String icon) {}

    public record PriorityArea(int rank,
                               String name,
                               double percentage,
                               double score0to5,
                               String level,
                               String color,
                               List<ReportArea> areas,
                               double improvementPotential) {}

    public record AssessmentReport(long assessmentId,
                                   String organizationName,
                                   Instant completedAt,
                                   double overallPercentage,
                                   String maturityLevel,
                                   String maturityDescription,
                                   double deviqScore,
                                   List<ReportSection> sections,
                                   Map<String, Integer> maturityDistribution,
                                   List<Insight> insights,
                                   List<PriorityArea> priorityAreas) {}
}
