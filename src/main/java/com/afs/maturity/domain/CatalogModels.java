package com.afs.maturity.domain;

import java.util.List;
import java.util.Optional;

public class CatalogModels {
    public record Section(String id, String name, String description, int displayOrder, String color, String icon) {}

    public record Area(String id, String sectionId, String name, String description, int displayOrder) {}

    public record Question(String id,
                           String areaId,
                           String text,
                           int displayOrder,
                           boolean active,
                           String level1,
                           String level2,
                           String level3,
                           String level4) {

        public boolean binary() {
            if (QuestionIds.isChecklistItem(id)) return true;
            return hasText(level1) && hasText(level2) && !hasText(level3) && !hasText(level4);
        }

        /** Reserved for differential weighting; every binary question currently weighs the same. */
        public double binaryWeight() {
            return binary() ? 1.0 : 0.0;
        }

        public int binarySubLevel() {
            return QuestionIds.subLevel(id);
        }

        public String baseId() {
            return QuestionIds.baseId(id);
        }

        private static boolean hasText(String s) {
            return s != null && !s.isBlank();
        }
    }

    /**
     * Ordered snapshot of the question catalog. Lists are sorted by display order
     * (areas and questions within their parent).
     */
    public record Catalog(List<Section> sections, List<Area> areas, List<Question> questions) {
        public Optional<Section> section(String sectionId) {
            return sections.stream().filter(s -> s.id().equals(sectionId)).findFirst();
        }

        public Optional<Area> area(String areaId) {
            return areas.stream().filter(a -> a.id().equals(areaId)).findFirst();
        }

        public Optional<Question> question(String questionId) {
            return questions.stream().filter(q -> q.id().equals(questionId)).findFirst();
        }

        public List<Area> areasOf(String sectionId) {
            return areas.stream().filter(a -> a.sectionId().equals(sectionId)).toList();
        }

        public List<Question> questionsOf(String areaId) {
            return questions.stream().filter(q -> q.areaId().equals(areaId)).toList();
        }

        public List<String> sectionIds() {
            return sections.stream().map(Section::id).toList();
        }
    }
}
