package com.afs.maturity.scoring;

import com.afs.maturity.repository.ResponseJdbcRepository;
import com.afs.maturity.scoring.ScoringModels.CompletionStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Completion over logical questions: checklist rows sharing a base id count once, and a
 * logical question is answered as soon as any of its rows carries a score.
 */
@Component
public class CompletionCalculator {
    private final ResponseJdbcRepository responseRepository;
    private final double substantialThreshold;

    public CompletionCalculator(ResponseJdbcRepository responseRepository,
                                @Value("${assessment.completion.substantial-threshold:80.0}") double substantialThreshold) {
        this.responseRepository = responseRepository;
        this.substantialThreshold = substantialThreshold;
    }

    public CompletionStatus calculate(long assessmentId, QuestionScope scope) {
        return evaluate(scope.logicalGroups(), responseRepository.answeredQuestionIds(assessmentId));
    }

    public CompletionStatus evaluate(Map<String, List<String>> logicalGroups, Set<String> answeredQuestionIds) {
        int answered = (int) logicalGroups.values().stream()
                .filter(members -> members.stream().anyMatch(answeredQuestionIds::contains))
                .count();
        return CompletionStatus.of(answered, logicalGroups.size(), substantialThreshold);
    }

    public double substantialThreshold() {
        return substantialThreshold;
    }
}
