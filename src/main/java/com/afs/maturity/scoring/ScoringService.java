package com.afs.maturity.scoring;

import com.afs.maturity.assessment.AssessmentModels.Assessment;
import com.afs.maturity.assessment.AssessmentModels.Response;
import com.afs.maturity.domain.CatalogModels.Area;
import com.afs.maturity.domain.CatalogModels.Catalog;
import com.afs.maturity.domain.CatalogModels.Question;
import com.afs.maturity.domain.CatalogModels.Section;
import com.afs.maturity.error.NotFoundException;
import com.afs.maturity.repository.AssessmentJdbcRepository;
import com.afs.maturity.repository.CatalogJdbcRepository;
import com.afs.maturity.repository.ResponseJdbcRepository;
import com.afs.maturity.scoring.ScoringModels.AreaScore;
import com.afs.maturity.scoring.ScoringModels.AssessmentScore;
import com.afs.maturity.scoring.ScoringModels.CompletionStatus;
import com.afs.maturity.scoring.ScoringModels.ImprovementPotential;
import com.afs.maturity.scoring.ScoringModels.ScoringMetadata;
import com.afs.maturity.scoring.ScoringModels.SectionScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Share-of-"Yes" scoring. Area = yes / in-scope questions, section = mean of its
 * participating areas, overall = mean of participating sections. Areas and sections
 * without in-scope questions are left out of every average.
 */
@Service
public class ScoringService {
    private static final Logger log = LoggerFactory.getLogger(ScoringService.class);

    private final CatalogJdbcRepository catalogRepository;
    private final ResponseJdbcRepository responseRepository;
    private final AssessmentJdbcRepository assessmentRepository;
    private final CompletionCalculator completionCalculator;
    private final String scoringVersion;

    public ScoringService(CatalogJdbcRepository catalogRepository,
                          ResponseJdbcRepository responseRepository,
                          AssessmentJdbcRepository assessmentRepository,
                          CompletionCalculator completionCalculator,
                          @Value("${assessment.scoring.version:2.0}") String scoringVersion) {
        this.catalogRepository = catalogRepository;
        this.responseRepository = responseRepository;
        this.assessmentRepository = assessmentRepository;
        this.completionCalculator = completionCalculator;
        this.scoringVersion = scoringVersion;
    }

    public AssessmentScore scoreAssessment(long assessmentId, ActiveSections active) {
        Assessment assessment = requireAssessment(assessmentId);
        Catalog catalog = catalogRepository.loadCatalog();
        QuestionScope scope = QuestionGroupResolver.resolve(catalog, active);
        Map<String, Response> responses = responseRepository.loadByQuestion(assessmentId);

        List<SectionScore> sections = catalog.sections().stream()
                .filter(s -> active.includes(s.id()))
                .map(s -> scoreSection(catalog, s, scope, responses))
                .filter(SectionScore::participates)
                .toList();

        double overall = ScoreMath.simpleAverage(sections.stream().map(SectionScore::percentage).toList());
        MaturityLevel level = MaturityLevel.classify(overall);
        double deviqScore = ScoreMath.legacyScore(overall);
        double gap = ScoreMath.round(Math.max(0.0, 1.0 - overall) * 100, 1);
        ImprovementPotential potential = new ImprovementPotential(deviqScore, level, MaturityLevel.OPTIMIZED,
                ScoreMath.LEGACY_MAX, ScoreMath.LEGACY_MAX, gap, gap, overall < 1.0);

        CompletionStatus completion = completionCalculator.calculate(assessmentId, scope);
        int inScopeResponses = (int) responses.keySet().stream().filter(scope::allows).count();
        ScoringMetadata metadata = new ScoringMetadata(assessment.updatedAt(), inScopeResponses, scoringVersion);

        log.info("Assessment {}: {}% ({}) over {} section(s)", assessmentId,
                ScoreMath.round(overall * 100, 1), level.displayName(), sections.size());

        return new AssessmentScore(assessmentId,
                assessmentName(assessment),
                overall,
                ScoreMath.round(overall * 5.0, 2),
                level,
                level.displayName(),
                level.description(),
                deviqScore,
                potential,
                sections,
                completion,
                metadata);
    }

    public SectionScore scoreSection(long assessmentId, String sectionId, QuestionScope scope) {
        requireAssessment(assessmentId);
        Catalog catalog = catalogRepository.loadCatalog();
        Section section = catalog.section(sectionId).orElseThrow(() -> new NotFoundException("Section", sectionId));
        return scoreSection(catalog, section, scope, responseRepository.loadByQuestion(assessmentId));
    }

    public AreaScore scoreArea(long assessmentId, String areaId, QuestionScope scope) {
        requireAssessment(assessmentId);
        Catalog catalog = catalogRepository.loadCatalog();
        Area area = catalog.area(areaId).orElseThrow(() -> new NotFoundException("Area", areaId));
        return scoreArea(catalog, area, scope, responseRepository.loadByQuestion(assessmentId));
    }

    private SectionScore scoreSection(Catalog catalog, Section section, QuestionScope scope, Map<String, Response> responses) {
        List<AreaScore> areas = catalog.areasOf(section.id()).stream()
                .map(a -> scoreArea(catalog, a, scope, responses))
                .filter(AreaScore::participates)
                .toList();
        if (areas.isEmpty()) {
            return SectionScore.empty(section.id(), section.name(), section.color(), section.icon());
        }

        double percentage = ScoreMath.simpleAverage(areas.stream().map(AreaScore::percentage).toList());
        int responded = areas.stream().mapToInt(AreaScore::responsesCount).sum();
        int total = areas.stream().mapToInt(AreaScore::totalQuestions).sum();

        return new SectionScore(section.id(), section.name(), section.color(), section.icon(),
                percentage,
                ScoreMath.legacyScore(percentage),
                ScoreMath.coverage(responded, total),
                responded,
                total,
                MaturityLevel.classify(percentage),
                areas);
    }

    private AreaScore scoreArea(Catalog catalog, Area area, QuestionScope scope, Map<String, Response> responses) {
        List<Question> questions = catalog.questionsOf(area.id()).stream()
                .filter(q -> scope.allows(q.id()))
                .toList();
        if (questions.isEmpty()) return AreaScore.empty(area.id(), area.name());

        int yes = 0;
        int responded = 0;
        for (Question q : questions) {
            Response r = responses.get(q.id());
            if (r == null || !r.answered()) continue;
            responded++;
            if (r.yes()) yes++;
        }

        int total = questions.size();
        double percentage = (double) yes / total;
        return new AreaScore(area.id(), area.name(),
                percentage,
                ScoreMath.legacyScore(percentage),
                ScoreMath.coverage(responded, total),
                responded,
                total,
                MaturityLevel.classify(percentage),
                1.0);
    }

    private Assessment requireAssessment(long assessmentId) {
        return assessmentRepository.find(assessmentId).orElseThrow(() -> new NotFoundException("Assessment", assessmentId));
    }

    private String assessmentName(Assessment a) {
        return a.organizationName() == null || a.organizationName().isBlank() ? "Assessment " + a.id() : a.organizationName();
    }
}
