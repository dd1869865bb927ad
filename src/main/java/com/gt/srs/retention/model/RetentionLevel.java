package com.gt.srs.retention.model;

public enum RetentionLevel {
    Mastered(0.95),
    Stable(0.85),
    ReviewSoon(0.70),
    Critical(0.50),
    Forgotten(0);

    private final double minRetrievability;

    RetentionLevel(double minRetrievability) {
        this.minRetrievability = minRetrievability;
    }

    public double getMinRetrievability() {
        return minRetrievability;
    }

    public boolean isAtRisk() {
        return this == Critical || this == Forgotten;
    }

    public static RetentionLevel fromRetrievability(double retrievability) {
        for (RetentionLevel level : values()) {
            if (retrievability >= level.getMinRetrievability()) {
                return level;
            }
        }

        return Forgotten;
    }
}
