package com.gt.srs.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.srs.exception.InvalidGradeException;
import com.gt.srs.serialization.GradeSerializer;

@JsonSerialize(using = GradeSerializer.class)
public enum Grade {
    Again(1),
    Hard(2),
    Good(3),
    Easy(4);

    private final int gradeValue;

    Grade(int gradeValue) {
        this.gradeValue = gradeValue;
    }

    public int getGradeValue() {
        return gradeValue;
    }

    public boolean isLapse() {
        return this == Again;
    }

    // Again and Hard both make the card harder; Good and Easy make it easier
    public boolean isStruggle() {
        return this == Again || this == Hard;
    }

    @JsonCreator
    public static Grade fromGradeValue(int gradeValue) {
        for (Grade grade : values()) {
            if (grade.gradeValue == gradeValue) {
                return grade;
            }
        }

        throw new InvalidGradeException("Invalid grade " + gradeValue + ". Grade must be 1 (Again), 2 (Hard), 3 (Good) or 4 (Easy).");
    }

    /**
     * Converts an assessment score into a grade. Scores above 1 are treated as percentages (0-100),
     * otherwise as fractions (0-1).
     * <ul>
     *     <li>below 40%: Again</li>
     *     <li>below 60%: Hard</li>
     *     <li>below 85%: Good</li>
     *     <li>otherwise: Easy</li>
     * </ul>
     */
    public static Grade fromScore(double score) {
        if (Double.isNaN(score) || score < 0 || score > 100) {
            throw new InvalidGradeException("Score " + score + " cannot be converted to a grade. Expected 0-1 or 0-100.");
        }

        double normalizedScore = score > 1 ? score / 100 : score;

        if (normalizedScore < 0.4) {
            return Again;
        } else if (normalizedScore < 0.6) {
            return Hard;
        } else if (normalizedScore < 0.85) {
            return Good;
        }

        return Easy;
    }
}
