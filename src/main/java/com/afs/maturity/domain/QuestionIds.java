package com.afs.maturity.domain;

import java.util.Map;

/**
 * Parsing of checklist question ids such as {@code FC-AIT-01C}: a trailing letter A-F
 * preceded by two digits marks one physical item of a logical question whose id is the
 * same string without the letter.
 */
public final class QuestionIds {
    private static final String SUFFIXES = "ABCDEF";
    private static final Map<Character, Integer> SUB_LEVELS = Map.of(
            'A', 1, 'B', 1,
            'C', 2,
            'D', 3, 'E', 3,
            'F', 4
    );

    private QuestionIds() {}

    public static boolean isChecklistItem(String id) {
        if (id == null || id.length() < 3) return false;
        char suffix = id.charAt(id.length() - 1);
        if (SUFFIXES.indexOf(suffix) < 0) return false;
        return Character.isDigit(id.charAt(id.length() - 2)) && Character.isDigit(id.charAt(id.length() - 3));
    }

    public static String baseId(String id) {
        return isChecklistItem(id) ? id.substring(0, id.length() - 1) : id;
    }

    public static int subLevel(String id) {
        if (id == null || id.isEmpty()) return 1;
        return SUB_LEVELS.getOrDefault(id.charAt(id.length() - 1), 1);
    }
}
