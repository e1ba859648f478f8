package com.afs.maturity.assessment;

import com.afs.maturity.assessment.AssessmentModels.*;
import com.afs.maturity.domain.CatalogModels.Area;
import com.afs.maturity.domain.CatalogModels.Catalog;
import com.afs.maturity.domain.CatalogModels.Question;
import com.afs.maturity.domain.CatalogModels.Section;
import com.afs.maturity.error.AssessmentStateException;
import com.afs.maturity.error.IncompleteAssessmentException;
import com.afs.maturity.error.NotFoundException;
import com.afs.maturity.error.ValidationException;
import com.afs.maturity.repository.AssessmentJdbcRepository;
import com.afs.maturity.repository.CatalogJdbcRepository;
import com.afs.maturity.repository.ResponseJdbcRepository;
import com.afs.maturity.scoring.ActiveSectionResolver;
import com.afs.maturity.scoring.ActiveSections;
import com.afs.maturity.scoring.CompletionCalculator;
import com.afs.maturity.scoring.QuestionGroupResolver;
import com.afs.maturity.scoring.QuestionScope;
import com.afs.maturity.scoring.ScoreMath;
import com.afs.maturity.scoring.ScoringModels.AssessmentScore;
import com.afs.maturity.scoring.ScoringModels.CompletionStatus;
import com.afs.maturity.scoring.ScoringService;
import com.afs.maturity.validation.AssessmentValidator;
import com.afs.maturity.validation.ValidationIssue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;

@Service
public class AssessmentService {
    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    private final AssessmentJdbcRepository repository;
    private final ResponseJdbcRepository responseRepository;
    private final CatalogJdbcRepository catalogRepository;
    private final ActiveSectionResolver activeSectionResolver;
    private final ScoringService scoringService;
    private final CompletionCalculator completionCalculator;
    private final AssessmentValidator validator;
    private final ObjectMapper objectMapper;

    public AssessmentService(AssessmentJdbcRepository repository,
                             ResponseJdbcRepository responseRepository,
                             CatalogJdbcRepository catalogRepository,
                             ActiveSectionResolver activeSectionResolver,
                             ScoringService scoringService,
                             CompletionCalculator completionCalculator,
                             AssessmentValidator validator,
                             ObjectMapper objectMapper) {
        this.repository = repository;
        this.responseRepository = responseRepository;
        this.catalogRepository = catalogRepository;
        this.activeSectionResolver = activeSectionResolver;
        this.scoringService = scoringService;
        this.completionCalculator = completionCalculator;
        this.validator = validator;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public Assessment create(CreateAssessmentRequest request) {
        List<ValidationIssue> issues = validator.validateCreate(request);
        if (!issues.isEmpty()) throw new ValidationException(issues);

        long id = repository.insert(request, Instant.now());
        log.info("Created assessment {} for {}", id, request.organizationName().trim());
        return get(id);
    }

    public Assessment get(long id) {
        return repository.find(id).orElseThrow(() -> new NotFoundException("Assessment", id));
    }

    public List<Assessment> list() {
        return repository.loadAll();
    }

    @Transactional
    public void delete(long id) {
        Assessment assessment = repository.lockForUpdate(id).orElseThrow(() -> new NotFoundException("Assessment", id));
        if (assessment.status() == AssessmentStatus.LOCKED) {
            throw new AssessmentStateException(id, assessment.status(), "Locked assessment " + id + " cannot be deleted");
        }
        repository.delete(id);
        log.info("Deleted assessment {} ({})", id, assessment.status());
    }

    @Transactional
    public SubmitAck submitResponses(long id, List<AnswerIn> answers) {
        Assessment assessment = repository.lockForUpdate(id).orElseThrow(() -> new NotFoundException("Assessment", id));
        if (assessment.status().frozen()) {
            log.warn("Rejected {} response(s) for {} assessment {}", answers == null ? 0 : answers.size(), assessment.status(), id);
            throw new AssessmentStateException(id, assessment.status(),
                    "Assessment " + id + " is " + assessment.status() + "; responses can no longer be changed");
        }

        Catalog catalog = catalogRepository.loadCatalog();
        QuestionScope scope = QuestionGroupResolver.resolve(catalog, activeSectionResolver.resolve(catalog));
        List<ValidationIssue> issues = validator.validateAnswers(answers, catalog, scope);
        if (!issues.isEmpty()) throw new ValidationException(issues);

        Instant now = Instant.now();
        for (AnswerIn answer : answers) {
            responseRepository.upsert(id, answer.questionId(), answer.score(), answer.notes(), now);
            log.debug("Stored response assessment={} question={} score={}", id, answer.questionId(), answer.score());
        }
        repository.touch(id, now);
        return new SubmitAck(id, answers.size(), completionCalculator.calculate(id, scope));
    }

    public List<Response> responses(long id) {
        get(id);
        return responseRepository.loadAll(id);
    }

    public ProgressReport progress(long id) {
        Assessment assessment = get(id);
        Catalog catalog = catalogRepository.loadCatalog();
        ActiveSections active = activeSectionResolver.resolve(catalog);
        QuestionScope scope = QuestionGroupResolver.resolve(catalog, active);
        List<Response> responses = responseRepository.loadAll(id);
        Set<String> answered = new HashSet<>();
        responses.stream().filter(Response::answered).forEach(r -> answered.add(r.questionId()));

        CompletionStatus completion = completionCalculator.evaluate(scope.logicalGroups(), answered);

        List<SectionProgress> sections = new ArrayList<>();
        NextQuestion next = null;
        for (Section section : catalog.sections()) {
            if (!active.includes(section.id())) continue;
            List<String> sectionQuestionIds = new ArrayList<>();
            for (Area area : catalog.areasOf(section.id())) {
                for (Question q : catalog.questionsOf(area.id())) {
                    if (!scope.allows(q.id())) continue;
                    sectionQuestionIds.add(q.id());
                    if (next == null && !answered.contains(q.id())) {
                        next = new NextQuestion(q.id(), section.id(), area.id(), q.text());
                    }
                }
            }
            Map<String, List<String>> groups = scope.logicalGroupsWithin(sectionQuestionIds);
            if (groups.isEmpty()) continue;
            int done = (int) groups.values().stream().filter(m -> m.stream().anyMatch(answered::contains)).count();
            sections.add(new SectionProgress(section.id(), section.name(), groups.size(), done,
                    ScoreMath.percentDown(done, groups.size()), done >= groups.size()));
        }

        Instant lastResponseAt = responses.stream().map(Response::answeredAt).max(Comparator.naturalOrder()).orElse(null);
        return new ProgressReport(id, assessment.status(), completion, completion.substantial(), sections, lastResponseAt, next);
    }

    /**
     * Freezes the assessment: gate check (unless forced), full scoring, COMPLETED status and
     * the JSON snapshot. An already frozen assessment returns its stored result.
     */
    @Transactional
    public FinalizeResult complete(long id, boolean force) {
        Assessment assessment = repository.lockForUpdate(id).orElseThrow(() -> new NotFoundException("Assessment", id));
        if (assessment.status().frozen()) {
            log.info("Assessment {} already {}", id, assessment.status());
            return new FinalizeResult(id, assessment.status(), assessment.completedAt(), false, frozenResult(assessment));
        }

        Catalog catalog = catalogRepository.loadCatalog();
        ActiveSections active = activeSectionResolver.resolve(catalog);
        CompletionStatus completion = completionCalculator.calculate(id, QuestionGroupResolver.resolve(catalog, active));
        if (!force && !completion.substantial()) {
            log.warn("Finalization of assessment {} rejected at {}% completion", id, completion.completionPercentage());
            throw new IncompleteAssessmentException(id, completion, completionCalculator.substantialThreshold());
        }

        AssessmentScore score = scoringService.scoreAssessment(id, active);
        Instant now = Instant.now();
        repository.markCompleted(id, now, score.deviqScore(), score.maturityLevel().name(), toJson(score));
        repository.replaceSectionScores(id, score.sections().stream()
                .map(s -> new SectionScoreRow(id, s.sectionId(), s.legacyScore(), s.percentage()))
                .toList());

        boolean forced = force && !completion.substantial();
        log.info("Completed assessment {} with score {} ({}){}", id, score.deviqScore(), score.maturityLevelDisplay(),
                forced ? " by force" : "");
        return new FinalizeResult(id, AssessmentStatus.COMPLETED, now, forced, score);
    }

    @Transactional
    public Assessment lock(long id) {
        Assessment assessment = repository.lockForUpdate(id).orElseThrow(() -> new NotFoundException("Assessment", id));
        if (assessment.status() == AssessmentStatus.LOCKED) return assessment;
        if (assessment.status() != AssessmentStatus.COMPLETED) {
            throw new AssessmentStateException(id, assessment.status(), "Only a completed assessment can be locked");
        }
        repository.updateStatus(id, AssessmentStatus.LOCKED, Instant.now());
        log.info("Locked assessment {}", id);
        return get(id);
    }

    /** Live score while in progress; the frozen snapshot once completed or locked. */
    public AssessmentScore results(long id) {
        Assessment assessment = get(id);
        if (assessment.status().frozen()) return frozenResult(assessment);
        Catalog catalog = catalogRepository.loadCatalog();
        return scoringService.scoreAssessment(id, activeSectionResolver.resolve(catalog));
    }

    public List<SectionScoreRow> sectionScores(long id) {
        get(id);
        return repository.loadSectionScores(id);
    }

    private AssessmentScore frozenResult(Assessment assessment) {
        Optional<String> json = repository.loadResultsJson(assessment.id());
        if (json.isPresent()) return fromJson(json.get());
        // Responses of a frozen assessment cannot change, so rescoring them is stable.
        Catalog catalog = catalogRepository.loadCatalog();
        return scoringService.scoreAssessment(assessment.id(), activeSectionResolver.resolve(catalog));
    }

    private String toJson(AssessmentScore score) {
        try {
            return objectMapper.writeValueAsString(score);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize result of assessment " + score.assessmentId(), e);
        }
    }

    private AssessmentScore fromJson(String json) {
        try {
            return objectMapper.readValue(json, AssessmentScore.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored result is not readable", e);
        }
    }
}
