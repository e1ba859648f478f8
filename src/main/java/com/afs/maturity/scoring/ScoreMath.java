package com.afs.maturity.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

public final class ScoreMath {
    public static final double LEGACY_MIN = 1.0;
    public static final double LEGACY_MAX = 4.0;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private ScoreMath() {}

    public static double simpleAverage(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public static double coverage(int responded, int total) {
        if (total <= 0) return 0.0;
        return Math.min(1.0, Math.max(0.0, (double) responded / total));
    }

    /** Linear remap of a 0..1 share onto the 1.0..4.0 scale older report fields expect. */
    public static double legacyScore(double percentage) {
        return round(LEGACY_MIN + percentage * (LEGACY_MAX - LEGACY_MIN), 2);
    }

    /** Percentage of {@code part} in {@code total}, truncated to one decimal so it never overstates progress. */
    public static double percentDown(int part, int total) {
        if (total <= 0) return 0.0;
        return BigDecimal.valueOf(part).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 1, RoundingMode.DOWN)
                .doubleValue();
    }

    /** Exact check of {@code part / total * 100 >= thresholdPercent}. */
    public static boolean reaches(int part, int total, double thresholdPercent) {
        if (total <= 0) return false;
        return BigDecimal.valueOf(part).multiply(HUNDRED)
                .compareTo(BigDecimal.valueOf(thresholdPercent).multiply(BigDecimal.valueOf(total))) >= 0;
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
