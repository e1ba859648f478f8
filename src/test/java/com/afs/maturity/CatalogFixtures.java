package com.afs.maturity;

import com.afs.maturity.assessment.AssessmentModels.AnswerIn;
import com.afs.maturity.assessment.AssessmentModels.CreateAssessmentRequest;
import com.afs.maturity.catalog.CatalogImportModels.AreaIn;
import com.afs.maturity.catalog.CatalogImportModels.CatalogDocument;
import com.afs.maturity.catalog.CatalogImportModels.QuestionIn;
import com.afs.maturity.catalog.CatalogImportModels.SectionIn;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;

public final class CatalogFixtures {
    public static final String SUFFIXES = "ABCDEF";

    private CatalogFixtures() {}

    public static void clearAssessments(JdbcTemplate jdbcTemplate) {
        jdbcTemplate.update("DELETE FROM assessments");
    }

    public static CreateAssessmentRequest acme() {
        return new CreateAssessmentRequest("Acme Corp", "acme", "Jane", "Doe", "jane@acme.test", "finance");
    }

    public static AnswerIn yes(String questionId) {
        return new AnswerIn(questionId, 2, null);
    }

    public static AnswerIn no(String questionId) {
        return new AnswerIn(questionId, 1, null);
    }

    public static SectionIn section(String id, int order) {
        return new SectionIn(id, "Section " + id, null, order, null, null);
    }

    public static AreaIn area(String id, String sectionId, int order) {
        return new AreaIn(id, sectionId, "Area " + id, null, order);
    }

    /** Six checklist rows {@code <base>A..<base>F}. */
    public static List<QuestionIn> checklist(String baseId, String areaId) {
        List<QuestionIn> out = new ArrayList<>();
        for (int i = 0; i < SUFFIXES.length(); i++) {
            out.add(new QuestionIn(baseId + SUFFIXES.charAt(i), areaId, "Checklist item " + baseId + SUFFIXES.charAt(i),
                    i + 1, true, null, null, null, null));
        }
        return out;
    }

    public static List<String> checklistIds(String baseId) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < SUFFIXES.length(); i++) out.add(baseId + SUFFIXES.charAt(i));
        return out;
    }

    public static QuestionIn plainBinary(String id, String areaId, int order) {
        return new QuestionIn(id, areaId, "Question " + id, order, true, "No", "Yes", null, null);
    }

    public static QuestionIn graded(String id, String areaId, int order) {
        return new QuestionIn(id, areaId, "Graded " + id, order, true, "Initial", "Managed", "Defined", "Optimized");
    }

    public static QuestionIn inactive(String id, String areaId, int order) {
        return new QuestionIn(id, areaId, "Retired " + id, order, false, "No", "Yes", null, null);
    }

    /** One section, three areas of six checklist rows: GOV-01, RSK-01, OPS-01. */
    public static CatalogDocument eighteenQuestions() {
        List<QuestionIn> questions = new ArrayList<>();
        questions.addAll(checklist("GOV-01", "SEC-A-GOV"));
        questions.addAll(checklist("RSK-01", "SEC-A-RSK"));
        questions.addAll(checklist("OPS-01", "SEC-A-OPS"));
        return new CatalogDocument(
                List.of(section("SEC-A", 1)),
                List.of(area("SEC-A-GOV", "SEC-A", 1), area("SEC-A-RSK", "SEC-A", 2), area("SEC-A-OPS", "SEC-A", 3)),
                questions);
    }

    /** SEC-A with GOV-01 and RSK-01, SEC-B with OPS-01. */
    public static CatalogDocument twoSections() {
        List<QuestionIn> questions = new ArrayList<>();
        questions.addAll(checklist("GOV-01", "SEC-A-GOV"));
        questions.addAll(checklist("RSK-01", "SEC-A-RSK"));
        questions.addAll(checklist("OPS-01", "SEC-B-OPS"));
        return new CatalogDocument(
                List.of(new SectionIn("SEC-A", "Governance", null, 1, "#2563eb", "fas fa-scale"),
                        new SectionIn("SEC-B", "Operations", null, 2, null, null)),
                List.of(area("SEC-A-GOV", "SEC-A", 1), area("SEC-A-RSK", "SEC-A", 2), area("SEC-B-OPS", "SEC-B", 1)),
                questions);
    }

    /** Five stand-alone binary questions plus one graded and one inactive question that never count. */
    public static CatalogDocument fiveQuestions() {
        return new CatalogDocument(
                List.of(section("GATE", 1)),
                List.of(area("GATE-AR", "GATE", 1)),
                List.of(plainBinary("GATE-Q1", "GATE-AR", 1),
                        plainBinary("GATE-Q2", "GATE-AR", 2),
                        plainBinary("GATE-Q3", "GATE-AR", 3),
                        plainBinary("GATE-Q4", "GATE-AR", 4),
                        plainBinary("GATE-Q5", "GATE-AR", 5),
                        graded("GATE-Q6", "GATE-AR", 6),
                        inactive("GATE-Q7", "GATE-AR", 7)));
    }
}
