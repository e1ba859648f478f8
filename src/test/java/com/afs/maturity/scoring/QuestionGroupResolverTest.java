package com.afs.maturity.scoring;

import com.afs.maturity.domain.CatalogModels.Area;
import com.afs.maturity.domain.CatalogModels.Catalog;
import com.afs.maturity.domain.CatalogModels.Question;
import com.afs.maturity.domain.CatalogModels.Section;
import com.afs.maturity.scoring.ScoringModels.CompletionStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QuestionGroupResolverTest {
    private final Catalog catalog = new Catalog(
            List.of(new Section("S1", "One", null, 1, null, null), new Section("S2", "Two", null, 2, null, null)),
            List.of(new Area("A1", "S1", "Area one", null, 1), new Area("A2", "S2", "Area two", null, 1)),
            List.of(checklist("X-01C"), checklist("X-01A"), checklist("X-01B"),
                    new Question("PLAIN", "A1", "plain", 4, true, "No", "Yes", null, null),
                    new Question("GRADED", "A1", "graded", 5, true, "1", "2", "3", "4"),
                    new Question("RETIRED", "A1", "retired", 6, false, "No", "Yes", null, null),
                    new Question("OTHER", "A2", "other", 1, true, "No", "Yes", null, null)));

    @Test
    void keepsOnlyActiveBinaryQuestionsOfActiveSections() {
        QuestionScope scope = QuestionGroupResolver.resolve(catalog, new ActiveSections(List.of("S1"), ActiveSections.Source.CONFIG));

        assertEquals(Set.of("X-01A", "X-01B", "X-01C", "PLAIN"), scope.allowedIds());
        assertFalse(scope.allows("GRADED"));
        assertFalse(scope.allows("RETIRED"));
        assertFalse(scope.allows("OTHER"));
    }

    @Test
    void groupsChecklistRowsInSuffixOrder() {
        QuestionScope scope = QuestionGroupResolver.resolve(catalog, ActiveSections.unrestricted());

        assertEquals(List.of("X-01A", "X-01B", "X-01C"), scope.groups().get("X-01"));
        Map<String, List<String>> logical = scope.logicalGroups();
        assertEquals(3, logical.size());
        assertTrue(logical.containsKey("X-01"));
        assertEquals(List.of("PLAIN"), logical.get("PLAIN"));
        assertEquals(List.of("OTHER"), logical.get("OTHER"));
    }

    @Test
    void checklistGroupCountsOnceHoweverManyRowsAreAnswered() {
        QuestionScope scope = QuestionGroupResolver.resolve(catalog, new ActiveSections(List.of("S1"), ActiveSections.Source.CONFIG));
        CompletionCalculator calculator = new CompletionCalculator(null, 80.0);

        CompletionStatus oneRow = calculator.evaluate(scope.logicalGroups(), Set.of("X-01B"));
        CompletionStatus allRows = calculator.evaluate(scope.logicalGroups(), Set.of("X-01A", "X-01B", "X-01C"));

        assertEquals(2, oneRow.totalQuestions());
        assertEquals(1, oneRow.answeredQuestions());
        assertEquals(oneRow, allRows);
        assertEquals(50.0, oneRow.completionPercentage());
    }

    private static Question checklist(String id) {
        return new Question(id, "A1", "item " + id, id.charAt(id.length() - 1) - 'A' + 1, true, null, null, null, null);
    }
}
