package com.afs.maturity.catalog;

import com.afs.maturity.validation.ValidationIssue;

import java.util.List;

public class CatalogImportModels {
    public record CatalogDocument(List<SectionIn> sections, List<AreaIn> areas, List<QuestionIn> questions) {}

    public record SectionIn(String id, String name, String description, Integer displayOrder, String color, String icon) {}

    public record AreaIn(String id, String sectionId, String name, String description, Integer displayOrder) {}

    public record QuestionIn(String id,
                             String areaId,
                             String text,
                             Integer displayOrder,
                             Boolean active,
                             String level1,
                             String level2,
                             String level3,
                             String level4) {}

    public record ImportResult(boolean valid, int sections, int areas, int questions, List<ValidationIssue> issues) {}

    public record QuestionView(String id,
                               String areaId,
                               String text,
                               int displayOrder,
                               boolean active,
                               boolean binary,
                               String baseId,
                               int binarySubLevel,
                               double binaryWeight) {}

    public record AreaView(String id, String name, String description, int displayOrder, List<QuestionView> questions) {}

    public record SectionView(String id, String name, String description, int displayOrder, String color, String icon,
                              boolean active, List<AreaView> areas) {}

    public record CatalogView(List<String> activeSectionIds, String activeSectionSource, List<SectionView> sections) {}
}
