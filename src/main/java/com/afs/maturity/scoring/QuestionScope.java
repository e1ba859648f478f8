package com.afs.maturity.scoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Questions in scope for one request: the allowed ids (active, binary, in an active section)
 * and the checklist groups keyed by base id.
 */
public record QuestionScope(Set<String> allowedIds, Map<String, List<String>> groups) {

    public boolean allows(String questionId) {
        return allowedIds.contains(questionId);
    }

    public Map<String, List<String>> logicalGroups() {
        return logicalGroupsWithin(allowedIds);
    }

    /** Logical questions over the given ids; an id outside every checklist group stands alone. */
    public Map<String, List<String>> logicalGroupsWithin(Collection<String> questionIds) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        Map<String, String> baseByMember = new LinkedHashMap<>();
        groups.forEach((base, members) -> members.forEach(m -> baseByMember.put(m, base)));

        for (String id : questionIds) {
            if (!allowedIds.contains(id)) continue;
            String key = baseByMember.getOrDefault(id, id);
            out.computeIfAbsent(key, k -> new ArrayList<>()).add(id);
        }
        return out;
    }
}
