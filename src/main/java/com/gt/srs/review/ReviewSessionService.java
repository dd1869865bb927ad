package com.gt.srs.review;

import com.gt.srs.card.CardService;
import com.gt.srs.conf.PGBeanConfig;
import com.gt.srs.due.DueCardSelector;
import com.gt.srs.exception.ConcurrentGradeConflictException;
import com.gt.srs.exception.InvalidGradeException;
import com.gt.srs.exception.StoreUnavailableException;
import com.gt.srs.exception.UnknownCardException;
import com.gt.srs.model.*;
import com.gt.srs.progress.ProgressDao;
import com.gt.srs.review.model.DueCardView;
import com.gt.srs.review.model.GradeRequest;
import com.gt.srs.review.model.GradeResult;
import com.gt.srs.scheduling.SchedulingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Entry point for the serving layer. Reads are side effect free; each grade is one read-compute-write
 * unit run in its own transaction and retried when a concurrent grade for the same card wins the race.
 */
@Component
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final CardService cardService;
    private final ProgressDao progressDao;
    private final SchedulingEngine schedulingEngine;
    private final DueCardSelector dueCardSelector;
    private final TransactionOperations transactionOperations;
    private final TransactionOperations snapshotTransactionOperations;
    private final Clock clock;
    private final int maxConflictRetries;
    private final Duration clientClockSkewTolerance;
    private final int maxSessionSize;

    @Autowired
    public ReviewSessionService(CardService cardService,
                                ProgressDao progressDao,
                                SchedulingEngine schedulingEngine,
                                DueCardSelector dueCardSelector,
                                @Qualifier(PGBeanConfig.GRADE_TRANSACTION_TEMPLATE) TransactionOperations transactionOperations,
                                @Qualifier(PGBeanConfig.SNAPSHOT_TRANSACTION_TEMPLATE) TransactionOperations snapshotTransactionOperations,
                                Clock clock,
                                @Value("${srs.grading.maxConflictRetries}") int maxConflictRetries,
                                @Value("${srs.grading.clientClockSkewTolerance}") Duration clientClockSkewTolerance,
                                @Value("${srs.due.maxSessionSize}") int maxSessionSize) {
        this.cardService = cardService;
        this.progressDao = progressDao;
        this.schedulingEngine = schedulingEngine;
        this.dueCardSelector = dueCardSelector;
        this.transactionOperations = transactionOperations;
        this.snapshotTransactionOperations = snapshotTransactionOperations;
        this.clock = clock;

        this.maxConflictRetries = Math.max(0, maxConflictRetries);
        this.clientClockSkewTolerance = clientClockSkewTolerance == null ? Duration.ZERO : clientClockSkewTolerance;
        this.maxSessionSize = maxSessionSize;
    }

    public List<DueCardView> getDue(long learnerId, Optional<String> scope, OptionalInt limit) {
        int sessionSize = Math.min(limit.orElse(maxSessionSize), maxSessionSize);

        // All batches are read in one snapshot so the session reflects a single point in time
        try {
            return snapshotTransactionOperations.execute(status ->
                    dueCardSelector.dueCards(learnerId, clock.instant(), scope, OptionalInt.of(sessionSize))
                            .stream()
                            .map(DueCardView::fromDueCard)
                            .toList());
        } catch (DataAccessException | TransactionException ex) {
            throw storeUnavailable("Unable to load due cards for learner " + learnerId, ex);
        }
    }

    public GradeResult grade(GradeRequest request) {
        Grade grade = Grade.fromGradeValue(request.grade());
        Instant reviewTime = resolveReviewTime(request.clientTimestamp() == null ? Optional.empty() : request.clientTimestamp());

        return grade(new ProgressKey(request.learnerId(), request.cardId()), grade, reviewTime,
                request.reviewEventId() == null ? Optional.empty() : request.reviewEventId());
    }

    public GradeResult grade(long learnerId, long cardId, Grade grade, Instant now) {
        return grade(new ProgressKey(learnerId, cardId), grade, now, Optional.empty());
    }

    public Map<Grade, Instant> previewGrades(long learnerId, long cardId) {
        ProgressKey key = new ProgressKey(learnerId, cardId);

        Card card = loadCard(key);
        try {
            return schedulingEngine.previewNextDue(key, card, progressDao.loadProgress(key), clock.instant());
        } catch (DataAccessException ex) {
            throw storeUnavailable("Unable to preview grades for " + key, ex);
        }
    }

    private GradeResult grade(ProgressKey key, Grade grade, Instant now, Optional<String> reviewEventId) {
        if (grade == null) {
            throw new InvalidGradeException("A grade is required to grade " + key);
        }

        Card card = loadCard(key);

        int attempt = 0;
        while (true) {
            try {
                Progress saved = transactionOperations.execute(status -> applyGrade(key, card, grade, now, reviewEventId));
                return GradeResult.fromProgress(saved);
            } catch (ConcurrentGradeConflictException ex) {
                if (++attempt > maxConflictRetries) {
                    log.warn("Giving up on grade for {} after {} conflicting attempts", key, attempt);
                    throw ex;
                }

                log.warn("Concurrent grade detected for {}. Retrying ({} of {}).", key, attempt, maxConflictRetries);
            } catch (DataAccessException | TransactionException ex) {
                throw storeUnavailable("Unable to save progress for " + key, ex);
            }
        }
    }

    private Progress applyGrade(ProgressKey key, Card card, Grade grade, Instant now, Optional<String> reviewEventId) {
        Optional<Progress> current = progressDao.loadProgress(key);

        if (reviewEventId.isPresent() && current.isPresent() && reviewEventId.get().equals(current.get().lastReviewEventId())) {
            log.warn("Review event {} was already applied to {}. Returning stored progress.", reviewEventId.get(), key);
            return current.get();
        }

        Progress updated = schedulingEngine.update(key, card, current, grade, now).withLastReviewEventId(reviewEventId.orElse(null));

        if (!progressDao.saveProgress(updated)) {
            throw new ConcurrentGradeConflictException("Progress for " + key + " changed while grading");
        }

        log.info("Graded {} as {}. Next review at {} (stability {}, status {}).", key, grade, updated.nextDueAt(), updated.stability(), updated.status());

        return updated;
    }

    private Card loadCard(ProgressKey key) {
        Card card;
        try {
            card = cardService.loadCard(key.cardId());
        } catch (DataAccessException ex) {
            throw storeUnavailable("Unable to load card for " + key, ex);
        }

        if (card == null) {
            String errMsg = "Card " + key.cardId() + " does not exist";

            log.error(errMsg);
            throw new UnknownCardException(errMsg);
        }

        return card;
    }

    // The server clock is authoritative unless the client's timestamp is within the configured tolerance
    private Instant resolveReviewTime(Optional<Instant> clientTimestamp) {
        Instant serverNow = clock.instant();

        if (clientTimestamp.isEmpty() || clientClockSkewTolerance.isZero() || clientClockSkewTolerance.isNegative()) {
            return serverNow;
        }

        Duration skew = Duration.between(serverNow, clientTimestamp.get()).abs();
        if (skew.compareTo(clientClockSkewTolerance) > 0) {
            log.warn("Client timestamp {} is {} away from server time. Using server time.", clientTimestamp.get(), skew);
            return serverNow;
        }

        return clientTimestamp.get();
    }

    private StoreUnavailableException storeUnavailable(String errMsg, RuntimeException ex) {
        log.error(errMsg, ex);
        return new StoreUnavailableException(errMsg, ex);
    }
}
