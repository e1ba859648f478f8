package com.afs.maturity.report;

import com.afs.maturity.assessment.AssessmentModels.Assessment;
import com.afs.maturity.assessment.AssessmentModels.Response;
import com.afs.maturity.assessment.AssessmentService;
import com.afs.maturity.catalog.CatalogService;
import com.afs.maturity.domain.CatalogModels.Catalog;
import com.afs.maturity.domain.CatalogModels.Question;
import com.afs.maturity.error.AssessmentStateException;
import com.afs.maturity.report.ReportModels.*;
import com.afs.maturity.scoring.ActiveSectionResolver;
import com.afs.maturity.scoring.MaturityLevel;
import com.afs.maturity.scoring.QuestionGroupResolver;
import com.afs.maturity.scoring.QuestionScope;
import com.afs.maturity.scoring.ScoreMath;
import com.afs.maturity.scoring.ScoringModels.AreaScore;
import com.afs.maturity.scoring.ScoringModels.AssessmentScore;
import com.afs.maturity.scoring.ScoringModels.SectionScore;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class ReportService {
    static final String DEFAULT_COLOR = "#6b7280";
    private static final double UNEVEN_SPREAD = 20.0;
    private static final double CONSISTENT_SPREAD = 5.0;

    private final AssessmentService assessmentService;
    private final CatalogService catalogService;
    private final ActiveSectionResolver activeSectionResolver;

    public ReportService(AssessmentService assessmentService,
                         CatalogService catalogService,
                         ActiveSectionResolver activeSectionResolver) {
        this.assessmentService = assessmentService;
        this.catalogService = catalogService;
        this.activeSectionResolver = activeSectionResolver;
    }

    public AssessmentReport report(long assessmentId) {
        Assessment assessment = assessmentService.get(assessmentId);
        if (!assessment.status().frozen()) {
            throw new AssessmentStateException(assessmentId, assessment.status(),
                    "Report is available once assessment " + assessmentId + " is completed");
        }
        Catalog catalog = catalogService.catalog();
        QuestionScope scope = QuestionGroupResolver.resolve(catalog, activeSectionResolver.resolve(catalog));
        Map<String, Response> responses = new HashMap<>();
        assessmentService.responses(assessmentId).forEach(r -> responses.put(r.questionId(), r));
        return build(assessment, assessmentService.results(assessmentId), new AreaCards(catalog, scope, responses));
    }

    AssessmentReport build(Assessment assessment, AssessmentScore score, AreaCards cards) {
        List<ReportSection> sections = score.sections().stream().map(s -> toSection(s, cards)).toList();
        return new AssessmentReport(assessment.id(),
                assessment.organizationName(),
                assessment.completedAt(),
                ScoreMath.round(score.overallPercentage() * 100, 1),
                score.maturityLevelDisplay(),
                score.maturityDescription(),
                score.deviqScore(),
                sections,
                distribution(sections),
                insights(sections),
                priorityAreas(sections));
    }

    private ReportSection toSection(SectionScore s, AreaCards cards) {
        List<ReportArea> areas = s.areas().stream().map(a -> toArea(a, cards)).toList();
        String color = s.color() == null || s.color().isBlank() ? DEFAULT_COLOR : s.color();
        return new ReportSection(s.sectionId(), s.sectionName(), color,
                ScoreMath.round(s.percentage() * 100, 1), s.legacyScore(), s.level().displayName(), areas);
    }

    private ReportArea toArea(AreaScore a, AreaCards cards) {
        List<String> strengths = new ArrayList<>();
        List<String> gaps = new ArrayList<>();
        for (Question q : cards.questionsOf(a.areaId())) {
            Response r = cards.responses().get(q.id());
            if (r != null && r.yes()) strengths.add(q.text());
            else gaps.add(q.text());
        }
        MaturityLevel level = a.level();
        return new ReportArea(a.areaId(), a.areaName(), ScoreMath.round(a.percentage() * 100, 1),
                level.displayName(), level.rank(), level.description(), strengths, gaps);
    }

    /** Catalog, scope and stored answers needed to list strengths and gaps per area. */
    record AreaCards(Catalog catalog, QuestionScope scope, Map<String, Response> responses) {
        List<Question> questionsOf(String areaId) {
            return catalog.questionsOf(areaId).stream().filter(q -> scope.allows(q.id())).toList();
        }
    }

    Map<String, Integer> distribution(List<ReportSection> sections) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (MaturityLevel level : MaturityLevel.values()) out.put(level.displayName(), 0);
        sections.forEach(s -> out.computeIfPresent(s.level(), (k, v) -> v + 1));
        return out;
    }

    List<Insight> insights(List<ReportSection> sections) {
        if (sections.isEmpty()) return List.of();
        ReportSection strongest = sections.stream().max(Comparator.comparingDouble(ReportSection::percentage)).orElseThrow();
        ReportSection weakest = sections.stream().min(Comparator.comparingDouble(ReportSection::percentage)).orElseThrow();

        List<Insight> out = new ArrayList<>();
        out.add(new Insight("strength", "Strongest Area: " + strongest.name(),
                String.format(Locale.US, "Your organization excels in %s with confirmed capabilities of %.1f%%",
                        strongest.name(), strongest.percentage()),
                "trophy"));
        out.add(new Insight("improvement", "Priority for Improvement: " + weakest.name(),
                String.format(Locale.US, "%s shows %.1f%% confirmed capabilities and offers the greatest opportunity for advancement",
                        weakest.name(), weakest.percentage()),
                "target"));

        double spread = strongest.percentage() - weakest.percentage();
        if (spread > UNEVEN_SPREAD) {
            out.add(new Insight("warning", "Uneven Maturity Distribution",
                    String.format(Locale.US, "Large gap (%.1f percentage points) between highest and lowest scoring areas suggests focused improvement needed", spread),
                    "exclamation-triangle"));
        } else if (spread < CONSISTENT_SPREAD) {
            out.add(new Insight("success", "Consistent Maturity Levels",
                    "Your organization shows consistent maturity across all assessment areas",
                    "check-circle"));
        }
        return out;
    }

    List<PriorityArea> priorityAreas(List<ReportSection> sections) {
        List<ReportSection> sorted = sections.stream()
                .sorted(Comparator.comparingDouble(ReportSection::percentage))
                .limit(3)
                .toList();
        List<PriorityArea> out = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            ReportSection s = sorted.get(i);
            List<ReportArea> weakestAreas = s.areas().stream()
                    .sorted(Comparator.comparingDouble(ReportArea::percentage))
                    .limit(2)
                    .toList();
            out.add(new PriorityArea(i + 1, s.name(), s.percentage(),
                    ScoreMath.round(s.percentage() / 100.0 * 5.0, 2),
                    s.level(), s.color(), weakestAreas,
                    ScoreMath.round(Math.max(0.0, 100.0 - s.percentage()), 1)));
        }
        return out;
    }
}
