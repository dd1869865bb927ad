package com.gt.srs.retention;

import com.gt.srs.due.DueCardDao;
import com.gt.srs.exception.StoreUnavailableException;
import com.gt.srs.model.Progress;
import com.gt.srs.model.ProgressStatus;
import com.gt.srs.progress.ProgressDao;
import com.gt.srs.retention.model.CardRetention;
import com.gt.srs.retention.model.RetentionLevel;
import com.gt.srs.retention.model.RetentionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of how well a learner currently remembers their cards, using the forgetting curve
 * {@code R = e^(-t/S)} where t is days since the last review and S is the card's stability.
 */
@Component
public class RetentionService {

    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private static final double SECONDS_PER_DAY = 86400d;

    private final ProgressDao progressDao;
    private final DueCardDao dueCardDao;

    @Autowired
    public RetentionService(ProgressDao progressDao, DueCardDao dueCardDao) {
        this.progressDao = progressDao;
        this.dueCardDao = dueCardDao;
    }

    public RetentionSummary getRetentionSummary(long learnerId, Instant now) {
        List<Progress> learnerProgress;
        int newCardCnt;
        try {
            learnerProgress = progressDao.loadLearnerProgress(learnerId);
            newCardCnt = dueCardDao.countNewCards(learnerId, "");
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load retention for learner " + learnerId;

            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }

        List<CardRetention> cardRetentions = new ArrayList<>();
        Map<ProgressStatus, Integer> countsByStatus = new EnumMap<>(ProgressStatus.class);
        for (ProgressStatus status : ProgressStatus.values()) {
            countsByStatus.put(status, 0);
        }
        countsByStatus.put(ProgressStatus.New, newCardCnt);

        int dueNow = 0;
        int atRiskCount = 0;
        double totalRetention = 0;

        for (Progress progress : learnerProgress) {
            CardRetention cardRetention = buildCardRetention(progress, now);
            cardRetentions.add(cardRetention);

            countsByStatus.merge(progress.status(), 1, Integer::sum);
            if (progress.isDue(now)) {
                dueNow++;
            }
            if (cardRetention.level().isAtRisk()) {
                atRiskCount++;
            }
            totalRetention += cardRetention.retrievability();
        }

        double averageRetention = learnerProgress.isEmpty() ? 0 : totalRetention / learnerProgress.size();

        return new RetentionSummary(learnerId, cardRetentions, dueNow, atRiskCount, averageRetention, countsByStatus);
    }

    /**
     * Retrievability for each day from 0 to {@code days} assuming no further reviews.
     */
    public List<Double> projectDecayCurve(double stability, int days) {
        if (days < 0) {
            throw new IllegalArgumentException("Cannot project a decay curve over " + days + " days");
        }

        List<Double> curve = new ArrayList<>(days + 1);
        for (int day = 0; day <= days; day++) {
            curve.add(calculateRetrievability(stability, day));
        }

        return curve;
    }

    public static double calculateRetrievability(double stability, double elapsedDays) {
        if (!(stability > 0) || elapsedDays < 0) {
            return 0;
        }

        return Math.exp(-elapsedDays / stability);
    }

    private CardRetention buildCardRetention(Progress progress, Instant now) {
        double retrievability = progress.lastReviewAt() == null
                ? 0
                : calculateRetrievability(progress.stability(), Duration.between(progress.lastReviewAt(), now).getSeconds() / SECONDS_PER_DAY);

        long daysUntilReview = progress.nextDueAt() == null
                ? 0
                : Math.max(0, Duration.between(now, progress.nextDueAt()).toDays());

        return new CardRetention(
                progress.cardId(),
                progress.stability(),
                retrievability,
                RetentionLevel.fromRetrievability(retrievability),
                daysUntilReview,
                progress.nextDueAt(),
                progress.lastReviewAt());
    }
}
