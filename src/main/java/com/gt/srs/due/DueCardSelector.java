package com.gt.srs.due;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Selects the cards a learner should study now. Due reviews come out most overdue first. New cards are
 * mixed in at a rate of at most one per {@code reviewsPerNewCard} reviews and fill the rest of the
 * sequence once the due reviews run out.
 */
@Component
public class DueCardSelector {

    private static final Logger log = LoggerFactory.getLogger(DueCardSelector.class);

    private final DueCardDao dueCardDao;
    private final int reviewsPerNewCard;
    private final int queryBatchSize;

    @Autowired
    public DueCardSelector(DueCardDao dueCardDao,
                           @Value("${srs.due.reviewsPerNewCard}") int reviewsPerNewCard,
                           @Value("${srs.due.queryBatchSize}") int queryBatchSize) {
        if (reviewsPerNewCard < 0) {
            throw new IllegalArgumentException("srs.due.reviewsPerNewCard cannot be negative");
        }
        if (queryBatchSize <= 0) {
            throw new IllegalArgumentException("srs.due.queryBatchSize must be positive");
        }

        this.dueCardDao = dueCardDao;
        this.reviewsPerNewCard = reviewsPerNewCard;
        this.queryBatchSize = queryBatchSize;
    }

    /**
     * An unknown learner is not an error: the learner simply has no progress and no enrolled cards, so
     * the sequence is empty.
     */
    public DueCardSequence dueCards(long learnerId, Instant now, Optional<String> scope, OptionalInt limit) {
        if (now == null) {
            throw new IllegalArgumentException("A query time is required to select due cards");
        }
        if (limit.isPresent() && limit.getAsInt() < 0) {
            throw new IllegalArgumentException("Limit cannot be negative but was " + limit.getAsInt());
        }

        int maxCards = limit.orElse(Integer.MAX_VALUE);
        if (maxCards == 0) {
            return DueCardSequence.EMPTY;
        }

        String scopeFilter = scope.filter(value -> !value.isBlank()).orElse("");   // blank disables the filter
        int batchSize = Math.min(queryBatchSize, maxCards);

        return new DueCardSequence(() -> new InterleavingIterator(
                new BatchCursor<>((lastCard, size) -> dueCardDao.loadDueReviewBatch(learnerId, scopeFilter, now, lastCard, size), batchSize),
                new BatchCursor<>((lastCard, size) -> dueCardDao.loadNewCardBatch(learnerId, scopeFilter, lastCard, size), batchSize),
                maxCards));
    }

    private class InterleavingIterator implements Iterator<DueCard> {

        private final BatchCursor<DueCard> reviewCursor;
        private final BatchCursor<DueCard> newCardCursor;
        private final int maxCards;

        private int returnedCnt = 0;
        private int reviewsSinceNewCard = 0;
        private DueCard pending = null;

        private InterleavingIterator(BatchCursor<DueCard> reviewCursor, BatchCursor<DueCard> newCardCursor, int maxCards) {
            this.reviewCursor = reviewCursor;
            this.newCardCursor = newCardCursor;
            this.maxCards = maxCards;
        }

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = selectNext();
            }

            return pending != null;
        }

        @Override
        public DueCard next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }

            DueCard dueCard = pending;
            pending = null;
            returnedCnt++;

            return dueCard;
        }

        private DueCard selectNext() {
            if (returnedCnt >= maxCards) {
                return null;
            }

            if (reviewsSinceNewCard >= reviewsPerNewCard && newCardCursor.hasNext()) {
                reviewsSinceNewCard = 0;
                return newCardCursor.next();
            }
            if (reviewCursor.hasNext()) {
                reviewsSinceNewCard++;
                return reviewCursor.next();
            }
            if (newCardCursor.hasNext()) {
                return newCardCursor.next();
            }

            log.debug("Due cards exhausted after {} cards", returnedCnt);
            return null;
        }
    }
}
