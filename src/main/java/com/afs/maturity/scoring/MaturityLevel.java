package com.afs.maturity.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Five ordered maturity bands over the share of confirmed ("Yes") capabilities.
 * Bands are upper-bound inclusive: 0-20 %, 21-40 %, 41-60 %, 61-80 %, 81-100 %.
 */
public enum MaturityLevel {
    INFORMAL(1, "Informal", 0.20,
            "Ad-hoc controls; limited consistency; practices not standardized."),
    DEFINED(2, "Defined", 0.40,
            "Controls defined; initial standardization; repeatable in pockets."),
    SYSTEMATIC(3, "Systematic", 0.60,
            "Controls systematically applied; governance emerging; wider coverage."),
    INTEGRATED(4, "Integrated", 0.80,
            "Controls integrated across lifecycle; cross-functional adoption; measurable."),
    OPTIMIZED(5, "Optimized", 1.00,
            "Controls optimized; continuous improvement; predictive and proactive.");

    private final int rank;
    private final String displayName;
    private final double upperBound;
    private final String description;

    MaturityLevel(int rank, String displayName, double upperBound, String description) {
        this.rank = rank;
        this.displayName = displayName;
        this.upperBound = upperBound;
        this.description = description;
    }

    public static MaturityLevel classify(double percentage) {
        double p = normalize(percentage);
        for (MaturityLevel level : values()) {
            if (p <= level.upperBound) return level;
        }
        return OPTIMIZED;
    }

    // Clamped to [0,1] and rounded to 4 places so that averaging noise such as 0.6000000000000001 stays in its band.
    static double normalize(double percentage) {
        if (Double.isNaN(percentage)) return 0.0;
        double clamped = Math.max(0.0, Math.min(1.0, percentage));
        return BigDecimal.valueOf(clamped).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    public int rank() {
        return rank;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }
}
