package com.afs.maturity;

import com.afs.maturity.assessment.AssessmentModels.AnswerIn;
import com.afs.maturity.assessment.AssessmentService;
import com.afs.maturity.catalog.CatalogImportModels.CatalogView;
import com.afs.maturity.catalog.CatalogImportModels.SectionView;
import com.afs.maturity.catalog.CatalogService;
import com.afs.maturity.error.ValidationException;
import com.afs.maturity.scoring.ScoringModels.AssessmentScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;

import static com.afs.maturity.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "assessment.active-section-ids=SEC-B, SEC-MISSING")
class ActiveSectionConfigTest {
    @Autowired
    private AssessmentService assessmentService;

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetData() {
        clearAssessments(jdbcTemplate);
        assertTrue(catalogService.importCatalog(twoSections()).valid());
    }

    @Test
    void catalogViewMarksConfiguredSections() {
        CatalogView view = catalogService.view();

        assertEquals("CONFIG", view.activeSectionSource());
        assertEquals(List.of("SEC-B", "SEC-MISSING"), view.activeSectionIds());
        assertEquals(List.of(false, true), view.sections().stream().map(SectionView::active).toList());
    }

    @Test
    void onlyConfiguredSectionsAreScored() {
        long id = assessmentService.create(acme()).id();
        List<AnswerIn> answers = new ArrayList<>();
        List<String> ops = checklistIds("OPS-01");
        for (int i = 0; i < ops.size(); i++) answers.add(i < 2 ? yes(ops.get(i)) : no(ops.get(i)));
        assessmentService.submitResponses(id, answers);

        AssessmentScore score = assessmentService.results(id);

        assertEquals(1, score.sections().size());
        assertEquals("SEC-B", score.sections().get(0).sectionId());
        assertEquals(2.0 / 6.0, score.overallPercentage(), 1e-9);
        assertEquals(1, score.completion().totalQuestions());
        assertTrue(score.completion().complete());
    }

    @Test
    void answersOutsideConfiguredSectionsAreRejected() {
        long id = assessmentService.create(acme()).id();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> assessmentService.submitResponses(id, List.of(yes("GOV-01A"))));
        assertEquals("QUESTION_NOT_ALLOWED", ex.getIssues().get(0).code());
    }
}
