package com.gt.srs.model;

import java.time.Instant;

/**
 * Memory model state for one learner and one card. A record only exists once the card has been
 * graded at least once; an absent record means the card is new.
 *
 * @param stability         estimated days of retention, always positive
 * @param difficulty        hardness estimate within [{@link #MIN_DIFFICULTY}, {@link #MAX_DIFFICULTY}]
 * @param version           row version, 1 after the first review and incremented by every update
 * @param lastReviewEventId caller supplied id of the review event that produced this state, may be null
 */
public record Progress(long learnerId,
                       long cardId,
                       double stability,
                       double difficulty,
                       Instant lastReviewAt,
                       Instant nextDueAt,
                       int repetitions,
                       int lapses,
                       ProgressStatus status,
                       long version,
                       String lastReviewEventId) {

    public static final double MIN_DIFFICULTY = 1.0;
    public static final double MAX_DIFFICULTY = 10.0;

    public Progress {
        if (!(stability > 0) || Double.isInfinite(stability)) {
            throw new IllegalArgumentException("Stability must be positive but was " + stability + " for learner " + learnerId + "/card " + cardId);
        }
        if (!(difficulty >= MIN_DIFFICULTY && difficulty <= MAX_DIFFICULTY)) {
            throw new IllegalArgumentException("Difficulty must be within [" + MIN_DIFFICULTY + ", " + MAX_DIFFICULTY + "] but was " + difficulty + " for learner " + learnerId + "/card " + cardId);
        }
        if (repetitions < 0 || lapses < 0) {
            throw new IllegalArgumentException("Review counts cannot be negative for learner " + learnerId + "/card " + cardId);
        }
        if (status == null) {
            throw new IllegalArgumentException("Status is required for learner " + learnerId + "/card " + cardId);
        }
    }

    public ProgressKey key() {
        return new ProgressKey(learnerId, cardId);
    }

    public boolean isDue(Instant now) {
        return nextDueAt == null || !nextDueAt.isAfter(now);
    }

    public Progress withLastReviewEventId(String reviewEventId) {
        return new Progress(learnerId, cardId, stability, difficulty, lastReviewAt, nextDueAt, repetitions, lapses, status, version, reviewEventId);
    }
}
