package com.afs.maturity.validation;

import com.afs.maturity.catalog.CatalogImportModels.AreaIn;
import com.afs.maturity.catalog.CatalogImportModels.CatalogDocument;
import com.afs.maturity.catalog.CatalogImportModels.QuestionIn;
import com.afs.maturity.catalog.CatalogImportModels.SectionIn;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class CatalogValidator {
    public List<ValidationIssue> validate(CatalogDocument doc) {
        List<ValidationIssue> errors = new ArrayList<>();
        if (doc == null) {
            errors.add(new ValidationIssue("EMPTY_CATALOG", "Catalog document is missing", "catalog"));
            return errors;
        }

        List<SectionIn> sections = orEmpty(doc.sections());
        List<AreaIn> areas = orEmpty(doc.areas());
        List<QuestionIn> questions = orEmpty(doc.questions());

        if (sections.isEmpty()) {
            errors.add(new ValidationIssue("EMPTY_CATALOG", "Catalog has no sections", "catalog"));
        }

        blankIds(sections.stream().map(SectionIn::id).toList(), "section", errors);
        blankIds(areas.stream().map(AreaIn::id).toList(), "area", errors);
        blankIds(questions.stream().map(QuestionIn::id).toList(), "question", errors);

        duplicate(sections.stream().map(SectionIn::id).toList(), "DUPLICATE_SECTION", "section", errors);
        duplicate(areas.stream().map(AreaIn::id).toList(), "DUPLICATE_AREA", "area", errors);
        duplicate(questions.stream().map(QuestionIn::id).toList(), "DUPLICATE_QUESTION", "question", errors);

        Set<String> sectionIds = sections.stream().map(SectionIn::id).filter(Objects::nonNull).collect(Collectors.toSet());
        areas.forEach(a -> {
            if (!sectionIds.contains(a.sectionId())) {
                errors.add(new ValidationIssue("SECTION_NOT_FOUND", "Area references unknown section: " + a.sectionId(), a.id()));
            }
        });

        Set<String> areaIds = areas.stream().map(AreaIn::id).filter(Objects::nonNull).collect(Collectors.toSet());
        questions.forEach(q -> {
            if (!areaIds.contains(q.areaId())) {
                errors.add(new ValidationIssue("AREA_NOT_FOUND", "Question references unknown area: " + q.areaId(), q.id()));
            }
            if (q.text() == null || q.text().isBlank()) {
                errors.add(new ValidationIssue("MISSING_TEXT", "Question has no text", q.id()));
            }
        });

        return errors;
    }

    private void blankIds(List<String> ids, String block, List<ValidationIssue> errors) {
        long blanks = ids.stream().filter(id -> id == null || id.isBlank()).count();
        if (blanks > 0) {
            errors.add(new ValidationIssue("MISSING_ID", blanks + " " + block + "(s) without id", block));
        }
    }

    private void duplicate(List<String> ids, String code, String block, List<ValidationIssue> errors) {
        Map<String, Long> counts = ids.stream().filter(Objects::nonNull)
                .collect(Collectors.groupingBy(id -> id, LinkedHashMap::new, Collectors.counting()));
        counts.forEach((id, n) -> {
            if (n > 1) {
                errors.add(new ValidationIssue(code, "Duplicate " + block + " id: " + id, id));
            }
        });
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
