package com.afs.maturity.validation;

import com.afs.maturity.assessment.AssessmentModels.AnswerIn;
import com.afs.maturity.assessment.AssessmentModels.CreateAssessmentRequest;
import com.afs.maturity.domain.CatalogModels.Catalog;
import com.afs.maturity.scoring.QuestionScope;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Component
public class AssessmentValidator {
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final int NO = 1;
    private static final int YES = 2;

    public List<ValidationIssue> validateCreate(CreateAssessmentRequest request) {
        List<ValidationIssue> errors = new ArrayList<>();
        if (request == null) {
            errors.add(new ValidationIssue("MISSING_BODY", "Request body is required", "assessment"));
            return errors;
        }
        if (request.organizationName() == null || request.organizationName().isBlank()) {
            errors.add(new ValidationIssue("MISSING_ORGANIZATION", "Organization name is required", "organizationName"));
        }
        if (request.email() != null && !request.email().isBlank() && !EMAIL.matcher(request.email().trim()).matches()) {
            errors.add(new ValidationIssue("INVALID_EMAIL", "Email is not well-formed: " + request.email(), "email"));
        }
        return errors;
    }

    public List<ValidationIssue> validateAnswers(List<AnswerIn> answers, Catalog catalog, QuestionScope scope) {
        List<ValidationIssue> errors = new ArrayList<>();
        if (answers == null || answers.isEmpty()) {
            errors.add(new ValidationIssue("NO_ANSWERS", "At least one answer is required", "answers"));
            return errors;
        }
        for (AnswerIn a : answers) {
            if (a == null || a.questionId() == null || a.questionId().isBlank()) {
                errors.add(new ValidationIssue("MISSING_QUESTION", "Answer without question id", "answers"));
                continue;
            }
            if (catalog.question(a.questionId()).isEmpty()) {
                errors.add(new ValidationIssue("QUESTION_NOT_FOUND", "Unknown question: " + a.questionId(), a.questionId()));
            } else if (!scope.allows(a.questionId())) {
                errors.add(new ValidationIssue("QUESTION_NOT_ALLOWED", "Question is inactive, not binary or outside the active sections: " + a.questionId(), a.questionId()));
            }
            if (a.score() == null || (a.score() != NO && a.score() != YES)) {
                errors.add(new ValidationIssue("INVALID_SCORE", "Score must be 1 (No) or 2 (Yes): " + a.score(), a.questionId()));
            }
        }
        return errors;
    }
}
