package com.gt.srs.scheduling;

import com.gt.srs.exception.InvalidGradeException;
import com.gt.srs.exception.UnknownCardException;
import com.gt.srs.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the next memory model state for a card after a graded review. The engine holds no state
 * and performs no I/O: identical inputs always produce an identical {@link Progress}. Persisting the
 * result is the caller's job.
 */
@Component
public class SchedulingEngine {

    private static final Logger log = LoggerFactory.getLogger(SchedulingEngine.class);

    private static final double PRECISION = 1_000_000d;

    private final SchedulingParameters parameters;

    @Autowired
    public SchedulingEngine(SchedulingParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @param key     learner and card being graded
     * @param card    the graded card, used for its base difficulty on a first review
     * @param current the stored progress, or empty when the card has never been reviewed
     * @param grade   recall quality reported by the learner
     * @param now     review time; becomes {@code lastReviewAt}
     * @return the progress to store, with {@code version} one higher than {@code current}
     * @throws InvalidGradeException if no grade is given
     * @throws UnknownCardException  if the card does not exist
     */
    public Progress update(ProgressKey key, Card card, Optional<Progress> current, Grade grade, Instant now) {
        if (grade == null) {
            throw new InvalidGradeException("A grade is required to update progress for " + key);
        }
        if (card == null) {
            throw new UnknownCardException("Card " + key.cardId() + " does not exist");
        }
        if (card.id() != key.cardId()) {
            throw new IllegalArgumentException("Card " + card.id() + " does not match " + key);
        }
        if (now == null) {
            throw new IllegalArgumentException("Review time is required to update progress for " + key);
        }

        double oldStability = current.map(Progress::stability).orElse(parameters.initialStability());
        double oldDifficulty = current.map(Progress::difficulty).orElseGet(() -> getInitialDifficulty(card));
        ProgressStatus oldStatus = current.map(Progress::status).orElse(ProgressStatus.New);

        double newStability = calculateStability(oldStability, grade);
        double newDifficulty = calculateDifficulty(oldDifficulty, grade);

        return new Progress(
                key.learnerId(),
                key.cardId(),
                newStability,
                newDifficulty,
                now,
                calculateNextDueAt(now, newStability),
                current.map(Progress::repetitions).orElse(0) + 1,
                current.map(Progress::lapses).orElse(0) + (grade.isLapse() ? 1 : 0),
                calculateStatus(oldStatus, grade, newStability),
                current.map(Progress::version).orElse(0L) + 1,
                null);
    }

    /**
     * Returns the due date each grade would produce without changing anything.
     */
    public Map<Grade, Instant> previewNextDue(ProgressKey key, Card card, Optional<Progress> current, Instant now) {
        Map<Grade, Instant> nextDueByGrade = new EnumMap<>(Grade.class);

        for (Grade grade : Grade.values()) {
            nextDueByGrade.put(grade, update(key, card, current, grade, now).nextDueAt());
        }

        return nextDueByGrade;
    }

    /**
     * Due date for a card reviewed at {@code lastReviewAt}. Rounds up so a card never comes back a day early.
     */
    public static Instant calculateNextDueAt(Instant lastReviewAt, double stability) {
        return lastReviewAt.plus(Duration.ofDays((long) Math.ceil(stability)));
    }

    private double calculateStability(double oldStability, Grade grade) {
        double scaled = oldStability * parameters.multiplierFor(grade);

        if (scaled > parameters.maximumStabilityDays()) {
            log.info("Stability {} exceeds maximum of {} days. Capping.", scaled, parameters.maximumStabilityDays());
            scaled = parameters.maximumStabilityDays();
        }

        return round(Math.max(parameters.stabilityFloor(), scaled));
    }

    private double calculateDifficulty(double oldDifficulty, Grade grade) {
        if (grade.isStruggle()) {
            return round(Math.min(Progress.MAX_DIFFICULTY, oldDifficulty + parameters.difficultyIncrease()));
        }

        return round(Math.max(Progress.MIN_DIFFICULTY, oldDifficulty - parameters.difficultyDecrease()));
    }

    private ProgressStatus calculateStatus(ProgressStatus oldStatus, Grade grade, double newStability) {
        if (grade.isLapse()) {
            return ProgressStatus.Learning;
        }

        ProgressStatus newStatus = newStability > parameters.masteryThresholdDays() ? ProgressStatus.Mastered : ProgressStatus.Reviewing;

        // Only a lapse moves a card backwards
        return newStatus.isBefore(oldStatus) ? oldStatus : newStatus;
    }

    private double getInitialDifficulty(Card card) {
        Double baseDifficulty = card.baseDifficulty();
        if (baseDifficulty == null || baseDifficulty.isNaN()) {
            return parameters.defaultDifficulty();
        }

        return Math.min(Progress.MAX_DIFFICULTY, Math.max(Progress.MIN_DIFFICULTY, baseDifficulty));
    }

    private static double round(double value) {
        return Math.round(value * PRECISION) / PRECISION;
    }
}
