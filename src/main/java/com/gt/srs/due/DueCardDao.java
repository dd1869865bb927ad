package com.gt.srs.due;

import java.time.Instant;
import java.util.List;

/**
 * Range queries behind the due-card selection. An empty {@code scope} means no scope filter. Batches are
 * keyset paged: each call returns the rows that follow {@code lastCard} in the query's order, or the first
 * rows when {@code lastCard} is null.
 */
public interface DueCardDao {

    // Reviewed cards with nextDueAt <= now, ordered by nextDueAt then card id
    List<DueCard> loadDueReviewBatch(long learnerId, String scope, Instant now, DueCard lastCard, int batchSize);

    // Never reviewed cards in the learner's enrolled scopes, ordered by creation time then card id
    List<DueCard> loadNewCardBatch(long learnerId, String scope, DueCard lastCard, int batchSize);

    int countNewCards(long learnerId, String scope);
}
