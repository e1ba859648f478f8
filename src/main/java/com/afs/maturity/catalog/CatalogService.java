package com.afs.maturity.catalog;

import com.afs.maturity.catalog.CatalogImportModels.*;
import com.afs.maturity.domain.CatalogModels;
import com.afs.maturity.domain.CatalogModels.Catalog;
import com.afs.maturity.repository.CatalogJdbcRepository;
import com.afs.maturity.scoring.ActiveSectionResolver;
import com.afs.maturity.scoring.ActiveSections;
import com.afs.maturity.validation.CatalogValidator;
import com.afs.maturity.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class CatalogService {
    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final CatalogJdbcRepository repository;
    private final CatalogValidator validator;
    private final ActiveSectionResolver activeSectionResolver;

    public CatalogService(CatalogJdbcRepository repository,
                          CatalogValidator validator,
                          ActiveSectionResolver activeSectionResolver) {
        this.repository = repository;
        this.validator = validator;
        this.activeSectionResolver = activeSectionResolver;
    }

    @Transactional
    public ImportResult importCatalog(CatalogDocument doc) {
        List<ValidationIssue> issues = validator.validate(doc);
        if (!issues.isEmpty()) {
            log.warn("Catalog import rejected with {} issue(s)", issues.size());
            return new ImportResult(false, 0, 0, 0, issues);
        }

        List<CatalogModels.Section> sections = doc.sections().stream()
                .map(s -> new CatalogModels.Section(s.id(), s.name(), s.description(), orZero(s.displayOrder()), s.color(), s.icon()))
                .toList();
        List<CatalogModels.Area> areas = orEmpty(doc.areas()).stream()
                .map(a -> new CatalogModels.Area(a.id(), a.sectionId(), a.name(), a.description(), orZero(a.displayOrder())))
                .toList();
        List<CatalogModels.Question> questions = orEmpty(doc.questions()).stream()
                .map(q -> new CatalogModels.Question(q.id(), q.areaId(), q.text(), orZero(q.displayOrder()),
                        q.active() == null || q.active(), q.level1(), q.level2(), q.level3(), q.level4()))
                .toList();

        repository.replaceCatalog(sections, areas, questions);
        log.info("Catalog imported: {} section(s), {} area(s), {} question(s)", sections.size(), areas.size(), questions.size());
        return new ImportResult(true, sections.size(), areas.size(), questions.size(), List.of());
    }

    public Catalog catalog() {
        return repository.loadCatalog();
    }

    public CatalogView view() {
        Catalog catalog = repository.loadCatalog();
        ActiveSections active = activeSectionResolver.resolve(catalog);

        List<SectionView> sections = catalog.sections().stream()
                .map(s -> new SectionView(s.id(), s.name(), s.description(), s.displayOrder(), s.color(), s.icon(),
                        active.includes(s.id()),
                        catalog.areasOf(s.id()).stream()
                                .map(a -> new AreaView(a.id(), a.name(), a.description(), a.displayOrder(),
                                        catalog.questionsOf(a.id()).stream()
                                                .map(q -> new QuestionView(q.id(), q.areaId(), q.text(), q.displayOrder(), q.active(),
                                                        q.binary(), q.baseId(), q.binarySubLevel(), q.binaryWeight()))
                                                .toList()))
                                .toList()))
                .toList();
        return new CatalogView(active.ids(), active.source().name(), sections);
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
