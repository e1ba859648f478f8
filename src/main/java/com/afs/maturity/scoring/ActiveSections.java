package com.afs.maturity.scoring;

import java.util.Arrays;
import java.util.List;

/**
 * The set of sections taking part in scoring for one request. Resolved once at the
 * service entry point and passed down as a value.
 */
public record ActiveSections(List<String> ids, Source source) {
    public enum Source { CONFIG, ENVIRONMENT, CATALOG, UNRESTRICTED }

    public static ActiveSections unrestricted() {
        return new ActiveSections(List.of(), Source.UNRESTRICTED);
    }

    public static ActiveSections resolve(String configured, String environment, List<String> catalogSectionIds) {
        List<String> fromConfig = parse(configured);
        if (!fromConfig.isEmpty()) return new ActiveSections(fromConfig, Source.CONFIG);

        List<String> fromEnv = parse(environment);
        if (!fromEnv.isEmpty()) return new ActiveSections(fromEnv, Source.ENVIRONMENT);

        if (catalogSectionIds != null && !catalogSectionIds.isEmpty()) {
            return new ActiveSections(List.copyOf(catalogSectionIds), Source.CATALOG);
        }
        return unrestricted();
    }

    public boolean includes(String sectionId) {
        return source == Source.UNRESTRICTED || ids.contains(sectionId);
    }

    static List<String> parse(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
