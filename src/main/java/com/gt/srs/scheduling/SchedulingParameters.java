package com.gt.srs.scheduling;

import com.gt.srs.model.Grade;
import com.gt.srs.model.Progress;

/**
 * Tunable constants of the scheduling model. Values are loaded from the {@code srs.scheduling.*}
 * properties; {@link #DEFAULTS} mirrors the shipped configuration.
 */
public record SchedulingParameters(double againMultiplier,
                                   double hardMultiplier,
                                   double goodMultiplier,
                                   double easyMultiplier,
                                   double stabilityFloor,
                                   double maximumStabilityDays,
                                   double initialStability,
                                   double defaultDifficulty,
                                   double difficultyIncrease,
                                   double difficultyDecrease,
                                   double masteryThresholdDays) {

    public static final SchedulingParameters DEFAULTS = new SchedulingParameters(
            0.25, 1.2, 1.5, 2.2,
            0.25, 36500, 1.0,
            5.0, 0.5, 0.2,
            21);

    // Rounding stability to 6 decimals means the floor has to survive rounding
    private static final double MIN_STABILITY_FLOOR = 0.001;

    public SchedulingParameters {
        requirePositive("againMultiplier", againMultiplier);
        requirePositive("hardMultiplier", hardMultiplier);
        requirePositive("goodMultiplier", goodMultiplier);
        requirePositive("easyMultiplier", easyMultiplier);

        if (!(stabilityFloor >= MIN_STABILITY_FLOOR)) {
            throw new IllegalArgumentException("stabilityFloor must be at least " + MIN_STABILITY_FLOOR + " but was " + stabilityFloor);
        }
        if (!(maximumStabilityDays >= stabilityFloor) || Double.isInfinite(maximumStabilityDays)) {
            throw new IllegalArgumentException("maximumStabilityDays must be finite and not below stabilityFloor but was " + maximumStabilityDays);
        }
        if (!(initialStability >= stabilityFloor && initialStability <= maximumStabilityDays)) {
            throw new IllegalArgumentException("initialStability must lie between stabilityFloor and maximumStabilityDays but was " + initialStability);
        }
        if (!(defaultDifficulty >= Progress.MIN_DIFFICULTY && defaultDifficulty <= Progress.MAX_DIFFICULTY)) {
            throw new IllegalArgumentException("defaultDifficulty must be within [1, 10] but was " + defaultDifficulty);
        }
        if (!(difficultyIncrease >= 0) || !(difficultyDecrease >= 0)) {
            throw new IllegalArgumentException("Difficulty steps cannot be negative");
        }
        requirePositive("masteryThresholdDays", masteryThresholdDays);
    }

    public double multiplierFor(Grade grade) {
        switch (grade) {
            case Again:
                return againMultiplier;
            case Hard:
                return hardMultiplier;
            case Good:
                return goodMultiplier;
            case Easy:
                return easyMultiplier;
            default:
                throw new IllegalArgumentException("No multiplier configured for grade " + grade);
        }
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive number but was " + value);
        }
    }
}
