package com.afs.maturity.scoring;

import com.afs.maturity.domain.CatalogModels.Area;
import com.afs.maturity.domain.CatalogModels.Catalog;
import com.afs.maturity.domain.CatalogModels.Question;
import com.afs.maturity.domain.CatalogModels.Section;
import com.afs.maturity.domain.QuestionIds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class QuestionGroupResolver {
    private QuestionGroupResolver() {}

    public static QuestionScope resolve(Catalog catalog, ActiveSections active) {
        Set<String> allowed = new LinkedHashSet<>();
        Map<String, List<String>> groups = new LinkedHashMap<>();

        for (Section section : catalog.sections()) {
            if (!active.includes(section.id())) continue;
            for (Area area : catalog.areasOf(section.id())) {
                for (Question q : catalog.questionsOf(area.id())) {
                    if (!q.active() || !q.binary()) continue;
                    allowed.add(q.id());
                    if (QuestionIds.isChecklistItem(q.id())) {
                        groups.computeIfAbsent(q.baseId(), k -> new ArrayList<>()).add(q.id());
                    }
                }
            }
        }
        groups.replaceAll((base, members) -> {
            List<String> sorted = new ArrayList<>(members);
            Collections.sort(sorted);
            return List.copyOf(sorted);
        });
        return new QuestionScope(Collections.unmodifiableSet(allowed), Collections.unmodifiableMap(groups));
    }
}
