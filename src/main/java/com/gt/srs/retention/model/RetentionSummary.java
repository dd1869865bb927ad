package com.gt.srs.retention.model;

import com.gt.srs.model.ProgressStatus;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * @param dueNow           reviewed cards whose next review time has passed
 * @param atRiskCount      cards at {@link RetentionLevel#Critical} or {@link RetentionLevel#Forgotten}
 * @param averageRetention mean retrievability over reviewed cards, 0 when there are none
 * @param countsByStatus   card counts per status; {@link ProgressStatus#New} counts enrolled cards never reviewed
 */
public record RetentionSummary(long learnerId,
                               List<CardRetention> cards,
                               int dueNow,
                               int atRiskCount,
                               double averageRetention,
                               Map<ProgressStatus, Integer> countsByStatus) {

    public RetentionSummary {
        cards = Collections.unmodifiableList(cards);
        countsByStatus = Collections.unmodifiableMap(countsByStatus);
    }
}
